package com.watchtide.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchtide.model.QueueItem;
import com.watchtide.model.QueueItemStatus;
import com.watchtide.service.LeaseQueue;
import com.watchtide.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the queue's conditional updates against a real database (H2).
 * Each repository call commits on its own, as in production.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class LeaseQueueRepositoryTest {

    @Autowired
    private QueueItemRepository repository;

    private MutableClock clock;
    private LeaseQueue queue;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        clock = new MutableClock(Instant.parse("2024-06-10T12:00:00Z"));
        queue = new LeaseQueue(repository, new ObjectMapper(), clock);
    }

    @Test
    @DisplayName("Second enqueue with the same dedup key keeps the first payload")
    void dedupOnEnqueue_keepsFirstPayload() {
        String first = queue.enqueue("gmail_history", Map.of("historyId", "A"), "gmail:a@x.com:100");
        String second = queue.enqueue("gmail_history", Map.of("historyId", "B"), "gmail:a@x.com:100");

        assertEquals(first, second);
        assertEquals(1, repository.count());
        QueueItem stored = repository.findById(first).orElseThrow();
        assertTrue(stored.getPayload().contains("\"A\""));
        assertEquals(QueueItemStatus.PENDING, stored.getStatus());
    }

    @Test
    @DisplayName("Inserting a new item over an existing id fails instead of overwriting")
    void newItemWithExistingId_isNotMerged() {
        String id = queue.enqueue("gmail_history", Map.of("historyId", "A"), "gmail:a@x.com:100");

        QueueItem clash = QueueItem.builder()
                .id(id)
                .type("gmail_history")
                .payload("{\"historyId\":\"B\"}")
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .newItem(true)
                .build();

        assertThrows(DataIntegrityViolationException.class, () -> repository.saveAndFlush(clash));
        assertTrue(repository.findById(id).orElseThrow().getPayload().contains("\"A\""));
    }

    @Test
    @DisplayName("Consecutive leases never hand out the same item")
    void consecutiveLeases_areDisjoint() {
        queue.enqueue("calendar_ping", Map.of("n", 1), "calendar:ch-1:1");
        queue.enqueue("calendar_ping", Map.of("n", 2), "calendar:ch-1:2");
        queue.enqueue("calendar_ping", Map.of("n", 3), "calendar:ch-1:3");

        List<QueueItem> firstBatch = queue.leaseNext(2, Duration.ofSeconds(60));
        List<QueueItem> secondBatch = queue.leaseNext(2, Duration.ofSeconds(60));
        List<QueueItem> thirdBatch = queue.leaseNext(2, Duration.ofSeconds(60));

        Set<String> first = firstBatch.stream().map(QueueItem::getId).collect(Collectors.toSet());
        Set<String> second = secondBatch.stream().map(QueueItem::getId).collect(Collectors.toSet());
        Set<String> overlap = new HashSet<>(first);
        overlap.retainAll(second);

        assertEquals(2, first.size());
        assertEquals(1, second.size());
        assertTrue(overlap.isEmpty());
        assertTrue(thirdBatch.isEmpty());
        assertEquals(3, repository.countByStatus(QueueItemStatus.LEASED));
    }

    @Test
    @DisplayName("Claiming an already leased item updates no rows")
    void claimOnLeasedItem_updatesNothing() {
        String id = queue.enqueue("calendar_ping", Map.of(), "calendar:ch-1:9");
        Instant now = clock.instant();

        int firstClaim = repository.claimLease(id, QueueItemStatus.PENDING, QueueItemStatus.LEASED, now.plusSeconds(60), now);
        int secondClaim = repository.claimLease(id, QueueItemStatus.PENDING, QueueItemStatus.LEASED, now.plusSeconds(60), now);

        assertEquals(1, firstClaim);
        assertEquals(0, secondClaim);
    }

    @Test
    @DisplayName("Expired leases are reclaimed to PENDING, live ones are not")
    void reclaimExpiredLeases() {
        queue.enqueue("calendar_ping", Map.of(), "calendar:ch-1:1");
        queue.leaseNext(1, Duration.ofSeconds(60));
        clock.advance(Duration.ofSeconds(30));
        queue.enqueue("calendar_ping", Map.of(), "calendar:ch-1:2");
        queue.leaseNext(1, Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(31));
        int reclaimed = queue.reclaimExpiredLeases();

        assertEquals(1, reclaimed);
        QueueItem first = repository.findById("calendar_ping_calendar_ch-1_1").orElseThrow();
        assertEquals(QueueItemStatus.PENDING, first.getStatus());
        assertNull(first.getLeaseUntil());
        assertEquals(QueueItemStatus.LEASED,
                repository.findById("calendar_ping_calendar_ch-1_2").orElseThrow().getStatus());
    }

    @Test
    @DisplayName("markDone clears the lease and sets DONE")
    void markDone() {
        String id = queue.enqueue("calendar_ping", Map.of(), "calendar:ch-1:5");
        queue.leaseNext(1, Duration.ofSeconds(60));

        queue.markDone(id);

        QueueItem done = repository.findById(id).orElseThrow();
        assertEquals(QueueItemStatus.DONE, done.getStatus());
        assertNull(done.getLeaseUntil());
    }
}

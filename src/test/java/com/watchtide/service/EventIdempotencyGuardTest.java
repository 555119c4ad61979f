package com.watchtide.service;

import com.watchtide.config.WatchtideProperties;
import com.watchtide.dto.IdempotencyStats;
import com.watchtide.model.EventSource;
import com.watchtide.model.IngestionStatus;
import com.watchtide.model.ProcessedEventRecord;
import com.watchtide.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class EventIdempotencyGuardTest {

    private MutableClock clock;
    private WatchtideProperties properties;
    private EventIdempotencyGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-10T12:00:00Z"));
        properties = new WatchtideProperties();
        guard = new EventIdempotencyGuard(properties, clock);
    }

    private ProcessedEventRecord record(String key, boolean success) {
        return ProcessedEventRecord.builder()
                .idempotencyKey(key)
                .eventId(key)
                .source(EventSource.GMAIL_PUSH)
                .status(success ? IngestionStatus.ENQUEUED : IngestionStatus.DUPLICATE)
                .processedAt(clock.instant())
                .success(success)
                .build();
    }

    @Test
    @DisplayName("Key joins event id and delivery attempt")
    void deriveKey() {
        assertEquals("1234567890_2", EventIdempotencyGuard.deriveKey("1234567890", 2));
        assertNotEquals(EventIdempotencyGuard.deriveKey("e", 1), EventIdempotencyGuard.deriveKey("e", 2));
    }

    @Test
    @DisplayName("Recorded outcome is returned verbatim")
    void recordedOutcome_isReturnedVerbatim() {
        ProcessedEventRecord first = record("evt_1", true);
        guard.record(first);

        assertTrue(guard.isProcessed("evt_1"));
        assertSame(first, guard.getResult("evt_1").orElseThrow());
    }

    @Test
    @DisplayName("Unknown and null keys are the normal not-yet-processed case")
    void missingKey_isNotProcessed() {
        assertFalse(guard.isProcessed("nope_1"));
        assertTrue(guard.getResult("nope_1").isEmpty());
        assertFalse(guard.isProcessed(null));
        assertTrue(guard.getResult(null).isEmpty());
    }

    @Test
    @DisplayName("First outcome for a key wins over later ones")
    void firstOutcomeWins() {
        ProcessedEventRecord first = record("evt_1", true);
        guard.record(first);
        guard.record(record("evt_1", false));

        assertSame(first, guard.getResult("evt_1").orElseThrow());
        assertEquals(1, guard.stats().getTotalRecorded());
    }

    @Test
    @DisplayName("At capacity the oldest inserted entry is evicted")
    void evictsOldestAtCapacity() {
        properties.getIdempotency().setCapacity(3);
        guard = new EventIdempotencyGuard(properties, clock);

        guard.record(record("a_1", true));
        guard.record(record("b_1", true));
        guard.record(record("c_1", true));
        guard.record(record("d_1", true));

        assertFalse(guard.isProcessed("a_1"));
        assertTrue(guard.isProcessed("b_1"));
        assertTrue(guard.isProcessed("d_1"));
        assertEquals(3, guard.stats().getSize());
    }

    @Test
    @DisplayName("Eviction follows insertion order even for recently read keys")
    void evictionIgnoresReads() {
        properties.getIdempotency().setCapacity(2);
        guard = new EventIdempotencyGuard(properties, clock);

        guard.record(record("a_1", true));
        guard.record(record("b_1", true));
        for (int i = 0; i < 5; i++) {
            assertTrue(guard.getResult("a_1").isPresent());
        }
        guard.record(record("c_1", true));

        assertFalse(guard.isProcessed("a_1"));
        assertTrue(guard.isProcessed("b_1"));
        assertTrue(guard.isProcessed("c_1"));
    }

    @Test
    @DisplayName("Sweep removes entries older than the retention window")
    void sweepRemovesExpired() {
        guard.record(record("old_1", true));
        clock.advance(Duration.ofHours(25));
        guard.record(record("new_1", true));

        int removed = guard.sweepExpired();

        assertEquals(1, removed);
        assertFalse(guard.isProcessed("old_1"));
        assertTrue(guard.isProcessed("new_1"));
    }

    @Test
    @DisplayName("Record without a key is ignored, not thrown")
    void keylessRecord_isIgnored() {
        assertDoesNotThrow(() -> guard.record(record(null, true)));
        assertDoesNotThrow(() -> guard.record(null));
        assertEquals(0, guard.stats().getSize());
    }

    @Test
    @DisplayName("Stats report size, total and success rate")
    void stats() {
        guard.record(record("a_1", true));
        guard.record(record("b_1", true));
        guard.record(record("c_1", true));
        guard.record(record("d_1", false));

        IdempotencyStats stats = guard.stats();

        assertEquals(4, stats.getSize());
        assertEquals(4, stats.getTotalRecorded());
        assertEquals(0.75, stats.getSuccessRate(), 1e-9);
    }
}

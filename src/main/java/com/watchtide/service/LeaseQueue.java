package com.watchtide.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchtide.dto.QueueStats;
import com.watchtide.model.QueueItem;
import com.watchtide.model.QueueItemStatus;
import com.watchtide.repository.QueueItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Durable work queue with time-bounded leases.
 *
 * FLOW:
 *   enqueue ──► PENDING ──leaseNext──► LEASED ──markDone──► DONE
 *                  ▲                      │
 *                  └── reclaim (expired) ─┤
 *                                         └──markFailed──► FAILED (terminal)
 *
 * Each arrow is one conditional row update. A worker that loses the
 * PENDING → LEASED race gets 0 rows back and skips the item, so an item is
 * leased to at most one worker at a time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LeaseQueue {

    static final int MAX_ID_LENGTH = 150;
    static final int MAX_ERROR_LENGTH = 2000;
    private static final int ID_HASH_LENGTH = 16;
    private static final Pattern UNSAFE_ID_CHARS = Pattern.compile("[\\s/\\\\#?%*:\\[\\]]+");

    private final QueueItemRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Makes a dedup key safe as a row id:
     *   sanitize("gmail_history:gmail:a@x.com:100") → "gmail_history_gmail_a@x.com_100"
     *
     * Over-long ids keep a prefix and end in a hash of the whole raw key, so
     * keys differing only past the cut still get distinct ids.
     */
    public static String sanitize(String raw) {
        String cleaned = UNSAFE_ID_CHARS.matcher(raw).replaceAll("_");
        if (cleaned.length() <= MAX_ID_LENGTH) {
            return cleaned;
        }
        String prefix = cleaned.substring(0, MAX_ID_LENGTH - ID_HASH_LENGTH - 1);
        return prefix + "_" + sha256Hex(raw).substring(0, ID_HASH_LENGTH);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public String enqueue(String type, Map<String, Object> payload, String dedupKey) {
        try {
            return enqueueRaw(type, objectMapper.writeValueAsString(payload), dedupKey, 0, null);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Queue payload is not serializable: " + e.getMessage(), e);
        }
    }

    /**
     * Inserts a pending item. With a dedup key the id is deterministic and
     * the insert is create-if-absent: a second call with the same
     * (type, dedupKey) leaves the first item untouched and returns its id.
     */
    public String enqueueRaw(String type, String payloadJson, String dedupKey, int retryCount, String originId) {
        boolean deduplicated = dedupKey != null && !dedupKey.isBlank();
        String id = deduplicated ? sanitize(type + ":" + dedupKey) : UUID.randomUUID().toString();

        if (deduplicated && repository.existsById(id)) {
            log.debug("Queue item already exists, skipping enqueue: id={}", id);
            return id;
        }

        Instant now = clock.instant();
        QueueItem item = QueueItem.builder()
                .id(id)
                .type(type)
                .status(QueueItemStatus.PENDING)
                .payload(payloadJson)
                .dedupKey(deduplicated ? dedupKey : null)
                .retryCount(retryCount)
                .originId(originId)
                .createdAt(now)
                .updatedAt(now)
                .newItem(true)
                .build();
        try {
            repository.saveAndFlush(item);
        } catch (DataIntegrityViolationException e) {
            if (!deduplicated) {
                throw e;
            }
            // Lost the insert race to a concurrent enqueue of the same key
            log.debug("Concurrent enqueue of same dedup key, keeping existing item: id={}", id);
            return id;
        }
        log.info("Enqueued item: id={}, type={}, retryCount={}", id, type, retryCount);
        return id;
    }

    /**
     * Claims up to max pending items. Never blocks; returns an empty list
     * when there is no work. Items another worker claimed first are skipped.
     */
    public List<QueueItem> leaseNext(int max, Duration leaseDuration) {
        if (max <= 0) {
            return List.of();
        }
        List<QueueItem> candidates = repository.findByStatusOrderByCreatedAtAsc(
                QueueItemStatus.PENDING, PageRequest.of(0, max));
        List<QueueItem> leased = new ArrayList<>();
        for (QueueItem candidate : candidates) {
            Instant now = clock.instant();
            Instant leaseUntil = now.plus(leaseDuration);
            try {
                int updated = repository.claimLease(candidate.getId(), QueueItemStatus.PENDING,
                        QueueItemStatus.LEASED, leaseUntil, now);
                if (updated == 1) {
                    candidate.setStatus(QueueItemStatus.LEASED);
                    candidate.setLeaseUntil(leaseUntil);
                    candidate.setUpdatedAt(now);
                    leased.add(candidate);
                } else {
                    log.debug("Lease lost to another worker: id={}", candidate.getId());
                }
            } catch (DataAccessException e) {
                log.warn("Lease claim failed, skipping until next poll: id={}, error={}",
                        candidate.getId(), e.getMessage());
            }
        }
        return leased;
    }

    public void markDone(String id) {
        int updated = repository.finish(id, QueueItemStatus.DONE, clock.instant());
        if (updated == 0) {
            log.warn("markDone for unknown queue item: id={}", id);
        }
    }

    /**
     * Terminal failure: attempts + 1, status FAILED, error recorded. Re-queueing
     * is left to the dead-letter path.
     */
    @Transactional
    public Optional<QueueItem> markFailed(String id, String error) {
        Optional<QueueItem> found = repository.findForUpdate(id);
        if (found.isEmpty()) {
            log.warn("markFailed for unknown queue item: id={}", id);
            return Optional.empty();
        }
        QueueItem item = found.get();
        item.setAttempts(item.getAttempts() + 1);
        item.setStatus(QueueItemStatus.FAILED);
        item.setLastError(truncate(error));
        item.setLeaseUntil(null);
        item.setUpdatedAt(clock.instant());
        return Optional.of(repository.save(item));
    }

    /**
     * Returns LEASED items whose lease ran out to PENDING. Attempts are not
     * incremented; a crashed worker is not the item's fault.
     */
    @Scheduled(fixedDelayString = "#{@watchtideProperties.queue.reclaimInterval.toMillis()}",
               initialDelayString = "#{@watchtideProperties.queue.reclaimInterval.toMillis()}")
    public int reclaimExpiredLeases() {
        int reclaimed = repository.releaseExpiredLeases(QueueItemStatus.LEASED, QueueItemStatus.PENDING,
                clock.instant());
        if (reclaimed > 0) {
            log.warn("Reclaimed {} expired leases", reclaimed);
        }
        return reclaimed;
    }

    public QueueStats stats() {
        Map<QueueItemStatus, Long> counts = new EnumMap<>(QueueItemStatus.class);
        long total = 0;
        for (QueueItemStatus status : QueueItemStatus.values()) {
            long count = repository.countByStatus(status);
            counts.put(status, count);
            total += count;
        }
        return new QueueStats(counts, total);
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }
}

package com.watchtide.service;

import com.watchtide.config.WatchtideProperties;
import com.watchtide.dto.IdempotencyStats;
import com.watchtide.model.ProcessedEventRecord;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-process ledger of handled deliveries.
 *
 * HOW IT WORKS:
 *   key = eventId + "_" + deliveryAttempt      e.g. "1234567890_2"
 *   1. Ingestion asks getResult(key) before doing anything
 *   2. A hit means the side effects already happened; the cached record is
 *      returned to the caller unchanged
 *   3. A miss is the normal first-delivery case; after processing, the
 *      outcome is stored with record()
 *
 * Bounded two ways: at capacity the oldest inserted entry is evicted (reads
 * do not refresh an entry), and an hourly sweep drops entries older than the
 * retention window. No method
 * throws; a broken record is logged and ignored.
 */
@Component
@Slf4j
public class EventIdempotencyGuard {

    private final Map<String, ProcessedEventRecord> records = new LinkedHashMap<>();
    private final int capacity;
    private final Duration retention;
    private final Clock clock;
    private long totalRecorded;

    public EventIdempotencyGuard(WatchtideProperties properties, Clock clock) {
        this.capacity = Math.max(1, properties.getIdempotency().getCapacity());
        this.retention = properties.getIdempotency().getRetention();
        this.clock = clock;
    }

    public static String deriveKey(String eventId, int deliveryAttempt) {
        return eventId + "_" + deliveryAttempt;
    }

    public synchronized boolean isProcessed(String key) {
        return key != null && records.containsKey(key);
    }

    public synchronized Optional<ProcessedEventRecord> getResult(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(key));
    }

    /**
     * Stores an outcome. The first outcome recorded for a key wins; later
     * calls with the same key are ignored so replays stay verbatim.
     */
    public synchronized void record(ProcessedEventRecord record) {
        if (record == null || record.getIdempotencyKey() == null) {
            log.warn("Ignoring idempotency record without a key: {}", record);
            return;
        }
        if (records.containsKey(record.getIdempotencyKey())) {
            log.debug("Idempotency key already recorded: key={}", record.getIdempotencyKey());
            return;
        }
        while (records.size() >= capacity) {
            Iterator<String> oldest = records.keySet().iterator();
            String evicted = oldest.next();
            oldest.remove();
            log.debug("Idempotency cache full, evicted key={}", evicted);
        }
        records.put(record.getIdempotencyKey(), record);
        totalRecorded++;
    }

    @Scheduled(fixedDelayString = "#{@watchtideProperties.idempotency.sweepInterval.toMillis()}",
               initialDelayString = "#{@watchtideProperties.idempotency.sweepInterval.toMillis()}")
    public synchronized int sweepExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        Iterator<ProcessedEventRecord> it = records.values().iterator();
        while (it.hasNext()) {
            ProcessedEventRecord record = it.next();
            if (record.getProcessedAt() == null || record.getProcessedAt().isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Idempotency sweep removed {} entries older than {}", removed, cutoff);
        }
        return removed;
    }

    public synchronized IdempotencyStats stats() {
        long successes = records.values().stream().filter(ProcessedEventRecord::isSuccess).count();
        double successRate = records.isEmpty() ? 0.0 : (double) successes / records.size();
        return new IdempotencyStats(records.size(), totalRecorded, successRate);
    }

    @PreDestroy
    public synchronized void clear() {
        records.clear();
    }
}

package com.watchtide.service;

import com.watchtide.config.WatchtideProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Durable delivery markers in Redis, shared by every instance.
 *
 * HOW IT WORKS:
 *   1. Ingestion derives provider-native markers for a delivery:
 *        pubsub:<messageId>
 *        gmail:<emailAddress>:<historyId>
 *        calendar:<channelId>:<messageNumber>
 *   2. isDuplicate(marker) does SET "watchtide:dedup:<marker>" NX with a TTL
 *   3. SET succeeded → first delivery; SET refused → duplicate
 *
 * Unlike the in-process idempotency ledger, markers survive restarts. A
 * Redis failure counts as "first delivery": the queue's dedup key still
 * stops a double enqueue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeduplicationService {

    private final StringRedisTemplate redisTemplate;
    private final WatchtideProperties properties;

    public static String pubsubMarker(String messageId) {
        return "pubsub:" + messageId;
    }

    public static String gmailMarker(String emailAddress, String historyId) {
        return "gmail:" + emailAddress + ":" + historyId;
    }

    public static String calendarMarker(String channelId, String messageNumber) {
        return "calendar:" + channelId + ":" + messageNumber;
    }

    /**
     * Returns true if the marker was already set, false if this call set it.
     */
    public boolean isDuplicate(String marker) {
        if (marker == null || marker.isBlank()) {
            return false;
        }
        String key = properties.getDedup().getKeyPrefix() + marker;
        try {
            Boolean wasSet = redisTemplate.opsForValue()
                    .setIfAbsent(key, "1", properties.getDedup().getTtl());
            if (Boolean.FALSE.equals(wasSet)) {
                log.info("Duplicate delivery detected: marker={}", marker);
                return true;
            }
            return false;
        } catch (DataAccessException e) {
            log.warn("Delivery marker check failed, treating as first delivery: marker={}, error={}",
                    marker, e.getMessage());
            return false;
        }
    }

    /**
     * Removes a marker so a redelivery can be processed, used when the
     * delivery could not be enqueued after the marker was set.
     */
    public void clearDedup(String marker) {
        if (marker == null || marker.isBlank()) {
            return;
        }
        try {
            redisTemplate.delete(properties.getDedup().getKeyPrefix() + marker);
            log.info("Cleared delivery marker: marker={}", marker);
        } catch (DataAccessException e) {
            log.warn("Failed to clear delivery marker, it expires with its TTL: marker={}, error={}",
                    marker, e.getMessage());
        }
    }
}

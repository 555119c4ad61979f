package com.watchtide.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchtide.config.WatchtideProperties;
import com.watchtide.dto.DeadLetterEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Brings failed queue items back as new pending items, a bounded number of
 * times.
 *
 * FLOW:
 *   watchtide.queue.dlq → DlqRetryConsumer reads the envelope
 *                               ↓
 *                 Is retryCount < maxRetries?
 *          ┌─── YES ──────────────┴──────────── NO ───┐
 *          ↓                                           ↓
 *    Wait (exponential backoff)             Send to watchtide.queue.dlq.dead
 *    enqueue(type, payload,                 Log CRITICAL alert
 *            dedupKey = retry:<originId>:<n>)
 *
 * The retry dedup key makes a redelivered envelope a no-op instead of a
 * second retry.
 *
 * BACKOFF (defaults):
 *   Retry 1 → 5 seconds
 *   Retry 2 → 25 seconds
 *   Retry 3 → 125 seconds
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DlqRetryConsumer {

    private final LeaseQueue leaseQueue;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ObjectMapper objectMapper;
    private final WatchtideProperties properties;

    @KafkaListener(topics = "${watchtide.topics.dlq:watchtide.queue.dlq}", groupId = "watchtide-dlq-processor")
    public void onDlqMessage(String message) {
        DeadLetterEnvelope envelope;
        try {
            envelope = objectMapper.readValue(message, DeadLetterEnvelope.class);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable dead letter, moving to permanent DLQ: {}", e.getMessage());
            deadLetterQueueService.sendToPermanentDlq(message, "Unparseable dead letter, cannot retry");
            return;
        }

        if (envelope.getType() == null || envelope.getQueueItemId() == null) {
            log.error("Dead letter missing type or queueItemId, parking permanently");
            deadLetterQueueService.sendToPermanentDlq(message, "Missing type or queueItemId");
            return;
        }

        int retryCount = envelope.getRetryCount();
        if (!deadLetterQueueService.isRetryable(retryCount)) {
            log.error("CRITICAL: Queue item exhausted all retries (count={}), moving to permanent DLQ: originId={}",
                    retryCount, envelope.getOriginId());
            deadLetterQueueService.sendToPermanentDlq(message, "Max retries exceeded: " + retryCount);
            return;
        }

        String originId = envelope.getOriginId() != null ? envelope.getOriginId() : envelope.getQueueItemId();
        int nextRetry = retryCount + 1;
        try {
            long delayMs = calculateBackoff(retryCount);
            log.info("Retrying dead letter: originId={}, attempt={}, backoff={}ms", originId, nextRetry, delayMs);
            Thread.sleep(delayMs);

            String id = leaseQueue.enqueueRaw(envelope.getType(), envelope.getPayload(),
                    "retry:" + originId + ":" + nextRetry, nextRetry, originId);
            log.info("Dead letter re-enqueued: originId={}, queueItemId={}, attempt={}", originId, id, nextRetry);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("DLQ retry interrupted: originId={}", originId);
        } catch (RuntimeException e) {
            log.error("Failed to re-enqueue dead letter: originId={}, error={}", originId, e.getMessage(), e);
            deadLetterQueueService.sendToPermanentDlq(message, "Re-enqueue failed: " + e.getMessage());
        }
    }

    long calculateBackoff(int retryCount) {
        long baseDelay = properties.getDlq().getBaseDelayMs();
        return baseDelay * (long) Math.pow(5, retryCount);
    }
}

package com.watchtide.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchtide.config.WatchtideProperties;
import com.watchtide.dto.DeadLetterEnvelope;
import com.watchtide.model.QueueItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Dead-letter topics for queue items whose handler failed.
 *
 * A failed item stays FAILED in the queue. Its envelope goes to the DLQ
 * topic with:
 *   - the item's type and payload
 *   - the error message
 *   - how many dead-letter retries already preceded it
 * DlqRetryConsumer decides whether it comes back as a new pending item.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueueService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final WatchtideProperties properties;
    private final Clock clock;

    public void sendToDlq(QueueItem item, String errorMessage) {
        try {
            DeadLetterEnvelope envelope = DeadLetterEnvelope.builder()
                    .queueItemId(item.getId())
                    .originId(item.originOrSelf())
                    .type(item.getType())
                    .payload(item.getPayload())
                    .error(errorMessage)
                    .retryCount(item.getRetryCount())
                    .timestamp(clock.millis())
                    .build();
            kafkaTemplate.send(properties.getTopics().getDlq(), item.originOrSelf(),
                    objectMapper.writeValueAsString(envelope));
            log.info("Queue item sent to DLQ: id={}, retryCount={}, error={}",
                    item.getId(), item.getRetryCount(), errorMessage);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to send queue item to DLQ: id={}, error={}", item.getId(), e.getMessage(), e);
        }
    }

    /**
     * Parks a dead-letter message for manual investigation; it is never
     * retried automatically.
     */
    public void sendToPermanentDlq(String originalDlqMessage, String reason) {
        try {
            Map<String, Object> permanentDlqMessage = new HashMap<>();
            permanentDlqMessage.put("originalDlqMessage", originalDlqMessage);
            permanentDlqMessage.put("reason", reason);
            permanentDlqMessage.put("timestamp", clock.millis());

            kafkaTemplate.send(properties.getTopics().getDlqDead(), objectMapper.writeValueAsString(permanentDlqMessage));
            log.error("CRITICAL: Dead letter moved to permanent DLQ: reason={}", reason);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to send to permanent DLQ: {}", e.getMessage(), e);
        }
    }

    public boolean isRetryable(int retryCount) {
        return retryCount < properties.getDlq().getMaxRetries();
    }
}

package com.watchtide.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchtide.dto.TaskMessage;
import com.watchtide.model.QueueItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Hands a queue item to downstream workers as a task message on a Kafka
 * topic, e.g. gmail_history → watchtide.tasks.gmail-history.
 *
 * The send waits for the broker acknowledgment so that markDone only
 * happens once the task is durable. Messages are keyed by mailbox or
 * channel to keep one resource's tasks in order on a partition.
 */
@Slf4j
public class TopicForwardingHandler implements EventHandler {

    static final long SEND_TIMEOUT_SECONDS = 10;

    private final String type;
    private final String topic;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TopicForwardingHandler(String type, String topic, KafkaTemplate<String, String> kafkaTemplate,
                                  ObjectMapper objectMapper, Clock clock) {
        this.type = type;
        this.topic = topic;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String type() {
        return type;
    }

    public String topic() {
        return topic;
    }

    @Override
    public void handle(QueueItem item, JsonNode payload) throws Exception {
        TaskMessage message = TaskMessage.builder()
                .type(item.getType())
                .id(item.getId())
                .idempotencyKey(item.originOrSelf())
                .payload(payload)
                .timestamp(clock.millis())
                .build();
        String key = partitionKey(item, payload);
        kafkaTemplate.send(topic, key, objectMapper.writeValueAsString(message))
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        log.info("Task forwarded: topic={}, key={}, queueItemId={}", topic, key, item.getId());
    }

    static String partitionKey(QueueItem item, JsonNode payload) {
        if (payload.hasNonNull("emailAddress")) {
            return payload.get("emailAddress").asText();
        }
        if (payload.hasNonNull("channelId")) {
            return payload.get("channelId").asText();
        }
        return item.getId();
    }
}

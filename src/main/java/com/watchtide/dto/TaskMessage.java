package com.watchtide.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

/**
 * Downstream handoff message published to a task topic.
 * idempotencyKey is the queue item id, stable across redeliveries.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TaskMessage {

    private String type;
    private String id;
    private String idempotencyKey;
    private JsonNode payload;
    private long timestamp;
}

package com.watchtide.dto;

import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IngestionHealthResponse {
    private Instant lastSuccessfulCallback;
    private long secondsSinceLastCallback;
    private boolean pollingFallbackActive;
    private IdempotencyStats idempotency;
}

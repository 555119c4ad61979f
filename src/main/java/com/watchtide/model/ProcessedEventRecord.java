package com.watchtide.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Idempotency ledger entry: the outcome of one handling attempt of an
 * inbound event. A key present in the ledger means the side effects already
 * ran (or were deliberately skipped) and this outcome is returned verbatim.
 */
@Value
@Builder
public class ProcessedEventRecord {

    String idempotencyKey;
    String eventId;
    EventSource source;
    IngestionStatus status;
    String queueItemId;
    Instant processedAt;
    boolean success;
    String errorMessage;
    long processingTimeMs;
}

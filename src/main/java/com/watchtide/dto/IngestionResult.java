package com.watchtide.dto;

import com.watchtide.model.IngestionStatus;
import com.watchtide.model.ProcessedEventRecord;
import lombok.Builder;
import lombok.Value;

/**
 * What the webhook path reports for one inbound call.
 *
 * duplicate is true when the outcome came from the idempotency ledger or a
 * delivery marker instead of fresh processing; in the ledger case record is
 * the first call's record, returned verbatim.
 */
@Value
@Builder
public class IngestionResult {

    IngestionStatus status;
    String idempotencyKey;
    String queueItemId;
    boolean duplicate;
    String reason;
    ProcessedEventRecord record;

    public boolean isRejected() {
        return status == IngestionStatus.REJECTED;
    }

    public static IngestionResult rejected(String reason) {
        return IngestionResult.builder()
                .status(IngestionStatus.REJECTED)
                .reason(reason)
                .build();
    }

    public static IngestionResult of(ProcessedEventRecord record, boolean duplicate) {
        return IngestionResult.builder()
                .status(record.getStatus())
                .idempotencyKey(record.getIdempotencyKey())
                .queueItemId(record.getQueueItemId())
                .duplicate(duplicate || record.getStatus() == IngestionStatus.DUPLICATE)
                .reason(record.getErrorMessage())
                .record(record)
                .build();
    }
}

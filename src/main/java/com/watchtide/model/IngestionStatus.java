package com.watchtide.model;

/**
 * Outcome of one pass through the ingestion path.
 */
public enum IngestionStatus {
    /** A queue item exists for the event (newly inserted or already present under its dedup key). */
    ENQUEUED,
    /** A provider-native delivery marker already existed. */
    DUPLICATE,
    /** Valid notification that carries no work, e.g. a calendar "sync" message. */
    IGNORED,
    /** Failed signature, token or replay checks. */
    REJECTED,
    /** Valid notification that could not be enqueued. */
    FAILED
}

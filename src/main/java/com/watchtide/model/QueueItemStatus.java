package com.watchtide.model;

/**
 * PENDING → LEASED → DONE | FAILED, and LEASED → PENDING when a lease expires unfinished.
 */
public enum QueueItemStatus {
    PENDING,
    LEASED,
    DONE,
    FAILED
}

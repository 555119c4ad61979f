package com.watchtide.model;

/**
 * Lifecycle of a watch channel:
 *   PENDING_CREATE → ACTIVE → RENEWING → (ACTIVE on the replacement | EXPIRED) → STOPPED
 *
 * Only PENDING_CREATE, ACTIVE and RENEWING are ever persisted; EXPIRED and
 * STOPPED channels are removed from the registry.
 */
public enum ChannelState {
    PENDING_CREATE,
    ACTIVE,
    RENEWING,
    EXPIRED,
    STOPPED
}

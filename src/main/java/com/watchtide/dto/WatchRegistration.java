package com.watchtide.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What a provider returns after accepting a watch.
 * expiration may be null when the provider keeps the requested one.
 */
@Value
@Builder
public class WatchRegistration {

    String resourceId;
    String resourceUri;
    Instant expiration;
    /** Starting cursor for change listing (mailbox historyId); null if the provider has none. */
    String checkpoint;
}

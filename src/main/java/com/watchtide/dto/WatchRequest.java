package com.watchtide.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Channel definition sent to a provider's watch endpoint.
 */
@Value
@Builder
public class WatchRequest {

    String channelId;
    String resourceKey;
    String token;
    /** Callback URL the provider will POST notifications to. */
    String address;
    Instant expiration;
}

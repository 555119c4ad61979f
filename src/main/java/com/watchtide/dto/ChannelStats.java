package com.watchtide.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class ChannelStats {

    long activeChannels;
    long totalChannels;
    Map<String, Long> byProvider;
    /** "provider:resourceKey" of every tracked channel. */
    List<String> resources;
    Instant nextExpiration;
    Instant oldestChannelCreatedAt;
}

package com.watchtide.dto;

import com.watchtide.model.ChannelState;
import com.watchtide.model.WatchChannel;
import com.watchtide.model.WatchProvider;
import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WatchChannelResponse {
    private String id;
    private WatchProvider provider;
    private String resourceKey;
    private String resourceId;
    private ChannelState state;
    /** First 8 characters only. */
    private String token;
    private String checkpoint;
    private Instant expiration;
    private Instant createdAt;
    private Instant updatedAt;

    public static WatchChannelResponse from(WatchChannel channel) {
        return WatchChannelResponse.builder()
                .id(channel.getId())
                .provider(channel.getProvider())
                .resourceKey(channel.getResourceKey())
                .resourceId(channel.getResourceId())
                .state(channel.getState())
                .token(channel.maskedToken())
                .checkpoint(channel.getCheckpoint())
                .expiration(channel.getExpiration())
                .createdAt(channel.getCreatedAt())
                .updatedAt(channel.getUpdatedAt())
                .build();
    }
}

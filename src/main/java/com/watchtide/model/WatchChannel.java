package com.watchtide.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One subscription to a provider resource.
 *
 * Example:
 *   id          = "calendar_primary_1718000000000_k3f9xq"
 *   provider    = CALENDAR
 *   resourceKey = "primary"
 *   resourceId  = "o3hgv1538sdjfh"   (assigned by the provider)
 *   expiration  = now + 7 days
 *
 * The (provider, resource_key) unique constraint keeps at most one live
 * channel per watched resource. The token authenticates inbound calls and
 * is excluded from toString(); log maskedToken() instead.
 */
@Entity
@Table(name = "watch_channels", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"provider", "resource_key"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@ToString(exclude = "token")
public class WatchChannel {

    @Id
    @Column(length = 200)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private WatchProvider provider;

    @Column(name = "resource_key", nullable = false)
    private String resourceKey;

    @Column(name = "resource_id")
    private String resourceId;

    @Column(name = "resource_uri", length = 1000)
    private String resourceUri;

    @Column(name = "channel_token")
    private String token;

    @Column(nullable = false)
    private Instant expiration;

    /**
     * Provider cursor for "list changes since": the mailbox historyId, or an
     * RFC 3339 updatedMin for calendars.
     */
    @Column(name = "change_checkpoint")
    private String checkpoint;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ChannelState state = ChannelState.PENDING_CREATE;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public WatchResource resource() {
        return new WatchResource(provider, resourceKey);
    }

    /**
     * Live means it may still receive notifications: created on the provider
     * side and not yet past its expiration.
     */
    public boolean isLiveAt(Instant now) {
        return (state == ChannelState.ACTIVE || state == ChannelState.RENEWING)
                && expiration != null
                && expiration.isAfter(now);
    }

    public String maskedToken() {
        return mask(token);
    }

    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "<none>";
        }
        return secret.substring(0, Math.min(8, secret.length())) + "...";
    }
}

package com.watchtide.model;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * A unit of durable work handed to the dispatcher.
 *
 * Items enqueued with a dedup key get a deterministic id derived from
 * "type:dedupKey", and are always inserted (never merged), so a second
 * enqueue under the same key hits the primary key instead of overwriting
 * the first payload.
 */
@Entity
@Table(name = "event_queue", indexes = {
    @Index(name = "idx_event_queue_status", columnList = "item_status"),
    @Index(name = "idx_event_queue_status_lease", columnList = "item_status, lease_until")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@ToString(exclude = "payload")
public class QueueItem implements Persistable<String> {

    @Id
    @Column(length = 150)
    private String id;

    @Column(name = "item_type", nullable = false, length = 100)
    private String type;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_status", nullable = false, length = 20)
    @Builder.Default
    private QueueItemStatus status = QueueItemStatus.PENDING;

    /** JSON document, opaque to the queue. */
    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Builder.Default
    private int attempts = 0;

    /** How many dead-letter re-enqueues preceded this item (0 for first-hand work). */
    @Column(name = "retry_count")
    @Builder.Default
    private int retryCount = 0;

    /** Id of the first item in a retry chain; null for first-hand work. */
    @Column(name = "origin_id", length = 150)
    private String originId;

    @Column(name = "dedup_key", length = 500)
    private String dedupKey;

    @Column(name = "lease_until")
    private Instant leaseUntil;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    @Builder.Default
    private boolean newItem = false;

    @Override
    public boolean isNew() {
        return newItem;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.newItem = false;
    }

    public String originOrSelf() {
        return originId != null ? originId : id;
    }
}

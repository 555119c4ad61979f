package com.watchtide.service;

import com.watchtide.model.EventSource;
import lombok.Value;

import java.time.Instant;

/**
 * Published after a push-delivered webhook was handled successfully.
 * Polled events never publish this.
 */
@Value
public class PushDeliveryEvent {

    EventSource source;
    String eventId;
    Instant receivedAt;
}

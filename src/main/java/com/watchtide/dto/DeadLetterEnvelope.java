package com.watchtide.dto;

import lombok.*;

/**
 * What lands on the dead-letter topic when a queue item fails.
 *
 * Example JSON:
 * {
 *   "queueItemId": "calendar_ping_calendar_ch-1_42",
 *   "originId": "calendar_ping_calendar_ch-1_42",
 *   "type": "calendar_ping",
 *   "payload": "{\"channelId\":\"ch-1\",\"messageNumber\":\"42\"}",
 *   "error": "Broker unavailable",
 *   "retryCount": 0,
 *   "timestamp": 1718000000000
 * }
 *
 * retryCount counts earlier dead-letter re-enqueues of the same origin item.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DeadLetterEnvelope {

    private String queueItemId;
    private String originId;
    private String type;
    private String payload;
    private String error;
    private int retryCount;
    private long timestamp;
}

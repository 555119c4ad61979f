package com.watchtide.dto;

import lombok.Builder;
import lombok.Value;

/**
 * One change returned by a provider's "list changes since" call.
 *
 *   calendar: eventId = event id,      marker = event "updated" timestamp
 *   mailbox:  eventId = historyId,     marker = historyId
 */
@Value
@Builder
public class PolledChange {

    String eventId;
    String marker;
}

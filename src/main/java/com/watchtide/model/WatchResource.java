package com.watchtide.model;

import lombok.Value;

/**
 * What a channel watches: one (provider, resource) pair. At most one live
 * channel exists per pair.
 */
@Value
public class WatchResource {

    WatchProvider provider;
    String resourceKey;

    public static WatchResource calendar(String calendarId) {
        return new WatchResource(WatchProvider.CALENDAR, calendarId);
    }

    public static WatchResource gmail(String emailAddress) {
        return new WatchResource(WatchProvider.GMAIL, emailAddress);
    }

    @Override
    public String toString() {
        return provider.name().toLowerCase() + ":" + resourceKey;
    }
}

package com.watchtide.model;

/**
 * The two classes of external providers a channel can watch.
 * GMAIL    → mail push (Pub/Sub), resource key is the mailbox address
 * CALENDAR → channel webhook, resource key is the calendar id
 */
public enum WatchProvider {
    GMAIL,
    CALENDAR
}

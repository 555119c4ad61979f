package com.watchtide.model;

public enum EventSource {
    GMAIL_PUSH,
    CALENDAR_WATCH,
    POLLING_FALLBACK
}

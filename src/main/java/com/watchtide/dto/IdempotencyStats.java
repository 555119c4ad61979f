package com.watchtide.dto;

import lombok.Value;

@Value
public class IdempotencyStats {

    int size;
    long totalRecorded;
    /** Share of cached records with success = true, 0.0 when empty. */
    double successRate;
}

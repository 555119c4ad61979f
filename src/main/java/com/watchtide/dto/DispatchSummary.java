package com.watchtide.dto;

import lombok.Value;

@Value
public class DispatchSummary {

    int leased;
    int succeeded;
    int failed;

    public static DispatchSummary empty() {
        return new DispatchSummary(0, 0, 0);
    }
}

package com.watchtide.dto;

import lombok.Value;

import java.util.List;

@Value
public class ChangeBatch {

    List<PolledChange> changes;
    /** Cursor to pass on the next poll; unchanged when nothing new arrived. */
    String nextCheckpoint;
}

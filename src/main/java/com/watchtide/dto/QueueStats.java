package com.watchtide.dto;

import com.watchtide.model.QueueItemStatus;
import lombok.Value;

import java.util.Map;

@Value
public class QueueStats {

    Map<QueueItemStatus, Long> counts;
    long total;
}

package com.watchtide.dto;

import com.watchtide.model.WatchChannel;
import lombok.Value;

/**
 * Outcome of an authenticity check. On success, channel is the registry entry
 * the request was matched to (null for signed mail pushes).
 */
@Value
public class ValidationResult {

    boolean valid;
    WatchChannel channel;
    String reason;

    public static ValidationResult accept(WatchChannel channel) {
        return new ValidationResult(true, channel, null);
    }

    public static ValidationResult reject(String reason) {
        return new ValidationResult(false, null, reason);
    }
}

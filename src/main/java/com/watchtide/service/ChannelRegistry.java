package com.watchtide.service;

import com.watchtide.model.WatchChannel;

import java.util.Optional;

/**
 * Read-only view of tracked channels, as seen by the authenticity check.
 */
public interface ChannelRegistry {

    Optional<WatchChannel> findChannel(String channelId);
}

package com.watchtide.service;

public class ChannelNotFoundException extends RuntimeException {

    public ChannelNotFoundException(String channelId) {
        super("Watch channel not found: " + channelId);
    }
}

package com.watchtide.controller;

import com.watchtide.dto.ChannelStats;
import com.watchtide.dto.WatchChannelResponse;
import com.watchtide.dto.WatchStartRequest;
import com.watchtide.model.WatchChannel;
import com.watchtide.model.WatchResource;
import com.watchtide.service.ChannelLifecycleManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Operator view of watch channels. Tokens are masked in every response.
 *
 * GET  /api/admin/channels               list
 * GET  /api/admin/channels/stats         counts and expirations
 * POST /api/admin/channels               {"provider": "CALENDAR", "resourceKey": "primary"}
 * POST /api/admin/channels/{id}/renew
 * POST /api/admin/channels/renew-all
 * POST /api/admin/channels/stop-all
 */
@RestController
@RequestMapping("/api/admin/channels")
@RequiredArgsConstructor
public class WatchAdminController {

    private final ChannelLifecycleManager channelManager;

    @GetMapping
    public List<WatchChannelResponse> list() {
        return channelManager.listChannels().stream()
                .map(WatchChannelResponse::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/stats")
    public ChannelStats stats() {
        return channelManager.getStats();
    }

    @PostMapping
    public ResponseEntity<WatchChannelResponse> start(@Valid @RequestBody WatchStartRequest request) {
        WatchChannel channel = channelManager.createWatchChannel(
                new WatchResource(request.getProvider(), request.getResourceKey()));
        return ResponseEntity.status(HttpStatus.CREATED).body(WatchChannelResponse.from(channel));
    }

    @PostMapping("/{id}/renew")
    public Map<String, Object> renew(@PathVariable String id) {
        WatchChannel channel = channelManager.getChannel(id);
        boolean renewed = channelManager.renewChannel(channel);
        return Map.of("resource", channel.resource().toString(), "renewed", renewed);
    }

    @PostMapping("/renew-all")
    public Map<String, Integer> renewAll() {
        return Map.of("renewed", channelManager.renewAll());
    }

    @PostMapping("/stop-all")
    public Map<String, Integer> stopAll() {
        return Map.of("stopped", channelManager.stopAllChannels());
    }
}

package com.watchtide.controller;

import com.watchtide.dto.DispatchSummary;
import com.watchtide.dto.IngestionHealthResponse;
import com.watchtide.dto.QueueStats;
import com.watchtide.service.EventDispatcher;
import com.watchtide.service.EventIdempotencyGuard;
import com.watchtide.service.LeaseQueue;
import com.watchtide.service.PollingFallbackService;
import com.watchtide.service.PushHealthMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * GET  /api/admin/queue/stats
 * POST /api/admin/queue/drain?max=10
 * POST /api/admin/queue/reclaim
 * GET  /api/admin/ingestion/health
 * POST /api/admin/ingestion/poll        one polling pass, regardless of push health
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class QueueAdminController {

    static final int MAX_DRAIN = 500;

    private final LeaseQueue leaseQueue;
    private final EventDispatcher eventDispatcher;
    private final PushHealthMonitor healthMonitor;
    private final PollingFallbackService pollingFallbackService;
    private final EventIdempotencyGuard idempotencyGuard;

    @GetMapping("/queue/stats")
    public QueueStats queueStats() {
        return leaseQueue.stats();
    }

    @PostMapping("/queue/drain")
    public DispatchSummary drain(@RequestParam(defaultValue = "10") int max) {
        if (max < 1 || max > MAX_DRAIN) {
            throw new IllegalArgumentException("max must be between 1 and " + MAX_DRAIN);
        }
        return eventDispatcher.drain(max);
    }

    @PostMapping("/queue/reclaim")
    public Map<String, Integer> reclaim() {
        return Map.of("reclaimed", leaseQueue.reclaimExpiredLeases());
    }

    @GetMapping("/ingestion/health")
    public IngestionHealthResponse ingestionHealth() {
        return IngestionHealthResponse.builder()
                .lastSuccessfulCallback(healthMonitor.getLastSuccessfulCallback())
                .secondsSinceLastCallback(healthMonitor.timeSinceLastCallback().getSeconds())
                .pollingFallbackActive(healthMonitor.isPollingFallbackActive())
                .idempotency(idempotencyGuard.stats())
                .build();
    }

    @PostMapping("/ingestion/poll")
    public Map<String, Integer> pollNow() {
        return Map.of("enqueued", pollingFallbackService.pollOnce());
    }
}

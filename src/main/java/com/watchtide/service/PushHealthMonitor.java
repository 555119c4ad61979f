package com.watchtide.service;

import com.watchtide.config.WatchtideProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Watches for push silence and switches the polling fallback on and off.
 *
 * State:
 *   lastSuccessfulCallback  instant of the latest push delivery handled end to end
 *   pollingFallbackActive   whether the poll timer is running
 *
 * Every tick: silent for longer than the stale threshold → start polling;
 * not silent and polling → stop. A push delivery also stops polling at once.
 */
@Component
@Slf4j
public class PushHealthMonitor {

    private final PollingFallbackService pollingFallbackService;
    private final TaskScheduler taskScheduler;
    private final WatchtideProperties properties;
    private final Clock clock;

    private final AtomicReference<Instant> lastSuccessfulCallback;
    private final AtomicBoolean pollingFallbackActive = new AtomicBoolean(false);
    private ScheduledFuture<?> pollTimer;

    public PushHealthMonitor(PollingFallbackService pollingFallbackService,
                             TaskScheduler taskScheduler,
                             WatchtideProperties properties,
                             Clock clock) {
        this.pollingFallbackService = pollingFallbackService;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
        this.lastSuccessfulCallback = new AtomicReference<>(clock.instant());
    }

    @Scheduled(fixedDelayString = "#{@watchtideProperties.health.checkInterval.toMillis()}",
               initialDelayString = "#{@watchtideProperties.health.checkInterval.toMillis()}")
    public synchronized void tick() {
        boolean stale = isStale();
        if (stale && !pollingFallbackActive.get()) {
            log.warn("No push delivery since {}, enabling polling fallback", lastSuccessfulCallback.get());
            enableFallback();
        } else if (!stale && pollingFallbackActive.get()) {
            log.info("Push delivery healthy, disabling polling fallback");
            disableFallback();
        }
    }

    @EventListener
    public void onPushDelivery(PushDeliveryEvent event) {
        recordSuccessfulCallback(event.getReceivedAt());
    }

    public synchronized void recordSuccessfulCallback(Instant at) {
        Instant previous = lastSuccessfulCallback.get();
        if (at != null && (previous == null || at.isAfter(previous))) {
            lastSuccessfulCallback.set(at);
        }
        if (pollingFallbackActive.get() && !isStale()) {
            log.info("Push delivery resumed, disabling polling fallback");
            disableFallback();
        }
    }

    public Instant getLastSuccessfulCallback() {
        return lastSuccessfulCallback.get();
    }

    public boolean isPollingFallbackActive() {
        return pollingFallbackActive.get();
    }

    public Duration timeSinceLastCallback() {
        return Duration.between(lastSuccessfulCallback.get(), clock.instant());
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (pollingFallbackActive.get()) {
            disableFallback();
        }
    }

    private boolean isStale() {
        return timeSinceLastCallback().compareTo(properties.getHealth().getStaleThreshold()) > 0;
    }

    private void enableFallback() {
        pollTimer = taskScheduler.scheduleAtFixedRate(pollingFallbackService::pollOnce,
                properties.getHealth().getPollingInterval());
        pollingFallbackActive.set(true);
    }

    private void disableFallback() {
        if (pollTimer != null) {
            pollTimer.cancel(false);
            pollTimer = null;
        }
        pollingFallbackActive.set(false);
    }
}

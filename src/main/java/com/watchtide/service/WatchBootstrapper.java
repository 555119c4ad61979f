package com.watchtide.service;

import com.watchtide.config.WatchtideProperties;
import com.watchtide.model.WatchResource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * On startup: re-arm renewal timers for channels from the previous run, then
 * make sure every configured calendar and mailbox is watched. A resource that
 * fails here is picked up again by the channel health sweep.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WatchBootstrapper {

    private final ChannelLifecycleManager channelManager;
    private final WatchtideProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        channelManager.restoreRenewalTimers();
        if (!properties.getChannels().isBootstrapOnStartup()) {
            log.info("Watch bootstrap disabled");
            return;
        }
        int watched = 0;
        for (WatchResource resource : channelManager.configuredResources()) {
            try {
                channelManager.ensureWatched(resource);
                watched++;
            } catch (RuntimeException e) {
                log.warn("Watch bootstrap failed, left to health sweep: resource={}, error={}",
                        resource, e.getMessage());
            }
        }
        log.info("Watch bootstrap complete: watched={}, configured={}",
                watched, channelManager.configuredResources().size());
    }
}

package com.watchtide.service;

import com.watchtide.dto.ChangeBatch;
import com.watchtide.dto.IngestionResult;
import com.watchtide.dto.PolledChange;
import com.watchtide.model.IngestionStatus;
import com.watchtide.model.WatchChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * One polling pass over every tracked channel: list the provider's changes
 * since the channel's checkpoint and feed each one through ingestion, as if
 * it had been pushed. A failure on one channel does not stop the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PollingFallbackService {

    private final ChannelLifecycleManager channelManager;
    private final WebhookIngestionService ingestionService;

    /**
     * @return number of changes that produced a new queue item
     */
    public int pollOnce() {
        List<WatchChannel> channels = channelManager.listChannels();
        int enqueued = 0;
        for (WatchChannel channel : channels) {
            try {
                enqueued += pollChannel(channel);
            } catch (RuntimeException e) {
                log.warn("Polling failed for channel, continuing: resource={}, error={}",
                        channel.resource(), e.getMessage());
            }
        }
        log.info("Polling pass complete: channels={}, enqueued={}", channels.size(), enqueued);
        return enqueued;
    }

    private int pollChannel(WatchChannel channel) {
        ChangeBatch batch = channelManager.clientFor(channel.getProvider())
                .listChanges(channel.getResourceKey(), channel.getCheckpoint());
        int enqueued = 0;
        boolean allHandled = true;
        for (PolledChange change : batch.getChanges()) {
            IngestionResult result = ingestionService.ingestPolled(channel, change);
            if (result.getStatus() == IngestionStatus.FAILED) {
                allHandled = false;
            } else if (result.getStatus() == IngestionStatus.ENQUEUED && !result.isDuplicate()) {
                enqueued++;
            }
        }
        // Keep the old cursor if anything failed so the next pass lists it again
        if (allHandled && batch.getNextCheckpoint() != null && !Objects.equals(batch.getNextCheckpoint(), channel.getCheckpoint())) {
            channelManager.updateCheckpoint(channel.getId(), batch.getNextCheckpoint());
        }
        return enqueued;
    }
}

package com.watchtide.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchtide.config.WatchtideProperties;
import com.watchtide.dto.DispatchSummary;
import com.watchtide.model.QueueItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Poll-and-lease loop over the queue.
 *
 * FLOW (every pollInterval):
 *   leaseNext(maxBatchSize, leaseDuration)
 *        ↓  for each leased item
 *   handler for item.type ──none──► markFailed("No handler registered for type <t>")
 *        ↓
 *   handler.handle(payload) ──throws──► markFailed(error) + dead-letter envelope
 *        ↓
 *   markDone
 *
 * One item's failure never stops the rest of the batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventDispatcher {

    private final LeaseQueue leaseQueue;
    private final EventHandlerRegistry handlerRegistry;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ObjectMapper objectMapper;
    private final WatchtideProperties properties;

    @Scheduled(fixedDelayString = "#{@watchtideProperties.queue.pollInterval.toMillis()}")
    public void poll() {
        if (!properties.getQueue().isDispatcherEnabled()) {
            return;
        }
        drain(properties.getQueue().getMaxBatchSize());
    }

    public DispatchSummary drain(int max) {
        List<QueueItem> items = leaseQueue.leaseNext(max, properties.getQueue().getLeaseDuration());
        if (items.isEmpty()) {
            return DispatchSummary.empty();
        }
        log.debug("Leased {} queue items", items.size());

        int succeeded = 0;
        int failed = 0;
        for (QueueItem item : items) {
            if (dispatch(item)) {
                succeeded++;
            } else {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Dispatch batch finished: leased={}, succeeded={}, failed={}", items.size(), succeeded, failed);
        }
        return new DispatchSummary(items.size(), succeeded, failed);
    }

    boolean dispatch(QueueItem item) {
        Optional<EventHandler> handler = handlerRegistry.find(item.getType());
        if (handler.isEmpty()) {
            fail(item, "No handler registered for type " + item.getType());
            return false;
        }

        try {
            JsonNode payload = objectMapper.readTree(item.getPayload());
            handler.get().handle(item, payload);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(item, "Interrupted while handling");
            return false;
        } catch (Exception e) {
            log.error("Handler failed: id={}, type={}, error={}", item.getId(), item.getType(), e.getMessage(), e);
            fail(item, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return false;
        }

        try {
            leaseQueue.markDone(item.getId());
        } catch (RuntimeException e) {
            // Handled but not acknowledged: the lease expires and the item is handled again
            log.error("markDone failed after successful handling: id={}, error={}", item.getId(), e.getMessage(), e);
        }
        return true;
    }

    private void fail(QueueItem item, String error) {
        try {
            leaseQueue.markFailed(item.getId(), error)
                    .ifPresent(failed -> deadLetterQueueService.sendToDlq(failed, error));
        } catch (RuntimeException e) {
            log.error("markFailed failed, item stays leased until reclaimed: id={}, error={}",
                    item.getId(), e.getMessage(), e);
        }
    }
}

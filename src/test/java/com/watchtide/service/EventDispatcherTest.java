package com.watchtide.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchtide.config.WatchtideProperties;
import com.watchtide.dto.DispatchSummary;
import com.watchtide.model.QueueItem;
import com.watchtide.model.QueueItemStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventDispatcherTest {

    @Mock private LeaseQueue leaseQueue;
    @Mock private EventHandlerRegistry handlerRegistry;
    @Mock private DeadLetterQueueService deadLetterQueueService;
    @Mock private EventHandler pingHandler;

    private WatchtideProperties properties;
    private EventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        properties = new WatchtideProperties();
        dispatcher = new EventDispatcher(leaseQueue, handlerRegistry, deadLetterQueueService,
                new ObjectMapper(), properties);
    }

    private static QueueItem item(String id, String type) {
        return QueueItem.builder()
                .id(id)
                .type(type)
                .status(QueueItemStatus.LEASED)
                .payload("{\"channelId\":\"ch-1\",\"messageNumber\":\"" + id + "\"}")
                .build();
    }

    private static QueueItem failed(QueueItem item, String error) {
        item.setStatus(QueueItemStatus.FAILED);
        item.setLastError(error);
        return item;
    }

    @Test
    @DisplayName("Successful handling marks the item done")
    void success_marksDone() throws Exception {
        QueueItem q1 = item("q1", "calendar_ping");
        when(leaseQueue.leaseNext(10, Duration.ofSeconds(60))).thenReturn(List.of(q1));
        when(handlerRegistry.find("calendar_ping")).thenReturn(Optional.of(pingHandler));

        DispatchSummary summary = dispatcher.drain(10);

        assertEquals(1, summary.getLeased());
        assertEquals(1, summary.getSucceeded());
        assertEquals(0, summary.getFailed());
        ArgumentCaptor<JsonNode> payload = ArgumentCaptor.forClass(JsonNode.class);
        verify(pingHandler).handle(eq(q1), payload.capture());
        assertEquals("ch-1", payload.getValue().get("channelId").asText());
        verify(leaseQueue).markDone("q1");
        verify(leaseQueue, never()).markFailed(anyString(), anyString());
    }

    @Test
    @DisplayName("Handler failure marks the item failed, dead-letters it and the batch continues")
    void handlerFailure_deadLettersAndContinues() throws Exception {
        QueueItem q1 = item("q1", "calendar_ping");
        QueueItem q2 = item("q2", "calendar_ping");
        when(leaseQueue.leaseNext(10, Duration.ofSeconds(60))).thenReturn(List.of(q1, q2));
        when(handlerRegistry.find("calendar_ping")).thenReturn(Optional.of(pingHandler));
        doThrow(new IllegalStateException("Broker unavailable"))
                .doNothing()
                .when(pingHandler).handle(any(QueueItem.class), any(JsonNode.class));
        when(leaseQueue.markFailed("q1", "Broker unavailable"))
                .thenReturn(Optional.of(failed(q1, "Broker unavailable")));

        DispatchSummary summary = dispatcher.drain(10);

        assertEquals(2, summary.getLeased());
        assertEquals(1, summary.getSucceeded());
        assertEquals(1, summary.getFailed());
        verify(deadLetterQueueService).sendToDlq(q1, "Broker unavailable");
        verify(leaseQueue).markDone("q2");
        verify(leaseQueue, never()).markDone("q1");
    }

    @Test
    @DisplayName("Unknown type fails with a descriptive error")
    void unknownType_fails() {
        QueueItem q1 = item("q1", "mystery");
        String error = "No handler registered for type mystery";
        when(leaseQueue.leaseNext(10, Duration.ofSeconds(60))).thenReturn(List.of(q1));
        when(handlerRegistry.find("mystery")).thenReturn(Optional.empty());
        when(leaseQueue.markFailed("q1", error)).thenReturn(Optional.of(failed(q1, error)));

        DispatchSummary summary = dispatcher.drain(10);

        assertEquals(1, summary.getFailed());
        verify(deadLetterQueueService).sendToDlq(q1, error);
    }

    @Test
    @DisplayName("Item already finished elsewhere is not dead-lettered")
    void markFailedOnFinishedItem_skipsDlq() throws Exception {
        QueueItem q1 = item("q1", "calendar_ping");
        when(leaseQueue.leaseNext(10, Duration.ofSeconds(60))).thenReturn(List.of(q1));
        when(handlerRegistry.find("calendar_ping")).thenReturn(Optional.of(pingHandler));
        doThrow(new RuntimeException("boom")).when(pingHandler).handle(any(QueueItem.class), any(JsonNode.class));
        when(leaseQueue.markFailed("q1", "boom")).thenReturn(Optional.empty());

        dispatcher.drain(10);

        verifyNoInteractions(deadLetterQueueService);
    }

    @Test
    @DisplayName("markDone failure after handling still counts as handled")
    void markDoneFailure_isLogged() {
        QueueItem q1 = item("q1", "calendar_ping");
        when(leaseQueue.leaseNext(10, Duration.ofSeconds(60))).thenReturn(List.of(q1));
        when(handlerRegistry.find("calendar_ping")).thenReturn(Optional.of(pingHandler));
        doThrow(new RuntimeException("connection reset")).when(leaseQueue).markDone("q1");

        DispatchSummary summary = assertDoesNotThrow(() -> dispatcher.drain(10));

        assertEquals(1, summary.getSucceeded());
        verifyNoInteractions(deadLetterQueueService);
    }

    @Test
    @DisplayName("Empty lease returns an empty summary")
    void emptyLease() {
        when(leaseQueue.leaseNext(10, Duration.ofSeconds(60))).thenReturn(List.of());

        DispatchSummary summary = dispatcher.drain(10);

        assertEquals(0, summary.getLeased());
        verifyNoInteractions(handlerRegistry);
    }

    @Test
    @DisplayName("Disabled dispatcher does not lease")
    void disabled_doesNotPoll() {
        properties.getQueue().setDispatcherEnabled(false);

        dispatcher.poll();

        verifyNoInteractions(leaseQueue);
    }

    @Test
    @DisplayName("Scheduled poll uses the configured batch size")
    void poll_usesBatchSize() {
        properties.getQueue().setMaxBatchSize(25);
        when(leaseQueue.leaseNext(25, Duration.ofSeconds(60))).thenReturn(List.of());

        dispatcher.poll();

        verify(leaseQueue).leaseNext(25, Duration.ofSeconds(60));
    }
}

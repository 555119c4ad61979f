package com.watchtide.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchtide.config.WatchtideProperties;
import com.watchtide.dto.IngestionResult;
import com.watchtide.dto.PolledChange;
import com.watchtide.dto.ValidationResult;
import com.watchtide.model.ChannelState;
import com.watchtide.model.EventSource;
import com.watchtide.model.IngestionStatus;
import com.watchtide.model.WatchChannel;
import com.watchtide.model.WatchProvider;
import com.watchtide.model.WatchResource;
import com.watchtide.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpHeaders;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Ingestion against a real idempotency guard; Redis markers are simulated
 * with an in-memory set.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WebhookIngestionServiceTest {

    private static final Instant T0 = Instant.parse("2024-06-10T12:00:00Z");
    private static final String FAILURES_TOPIC = "watchtide.webhook.failures";

    @Mock private WebhookAuthenticityValidator validator;
    @Mock private ChannelLifecycleManager channelManager;
    @Mock private DeduplicationService deduplicationService;
    @Mock private LeaseQueue leaseQueue;
    @Mock private ApplicationEventPublisher eventPublisher;
    @Mock private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Set<String> markers = new HashSet<>();
    private EventIdempotencyGuard guard;
    private WatchChannel calendarChannel;
    private WebhookIngestionService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(T0);
        WatchtideProperties properties = new WatchtideProperties();
        guard = new EventIdempotencyGuard(properties, clock);
        service = new WebhookIngestionService(validator, channelManager, guard, deduplicationService, leaseQueue,
                eventPublisher, kafkaTemplate, objectMapper, properties, clock);

        calendarChannel = WatchChannel.builder()
                .id("ch-1")
                .provider(WatchProvider.CALENDAR)
                .resourceKey("primary")
                .state(ChannelState.ACTIVE)
                .expiration(T0.plusSeconds(3600))
                .build();

        when(validator.validate(any(HttpHeaders.class), any(), any())).thenReturn(ValidationResult.accept(calendarChannel));
        when(deduplicationService.isDuplicate(anyString())).thenAnswer(inv -> !markers.add(inv.getArgument(0)));
        when(leaseQueue.enqueue(anyString(), anyMap(), anyString())).thenReturn("q-1");
    }

    private static String gmailBody(String messageId, int deliveryAttempt) {
        String data = Base64.getEncoder().encodeToString(
                "{\"emailAddress\":\"a@x.com\",\"historyId\":\"120\"}".getBytes(StandardCharsets.UTF_8));
        return "{\"message\":{\"messageId\":\"" + messageId + "\",\"data\":\"" + data
                + "\",\"publishTime\":\"2024-06-10T12:00:00Z\"},"
                + "\"subscription\":\"projects/p/subscriptions/s\",\"deliveryAttempt\":" + deliveryAttempt + "}";
    }

    private static HttpHeaders calendarHeaders(String messageNumber, String state) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(WebhookAuthenticityValidator.CHANNEL_ID_HEADER, "ch-1");
        headers.add(WebhookAuthenticityValidator.CHANNEL_TOKEN_HEADER, "tok");
        headers.add("X-Goog-Message-Number", messageNumber);
        headers.add("X-Goog-Resource-State", state);
        headers.add("X-Goog-Resource-ID", "res-1");
        return headers;
    }

    @Test
    @DisplayName("Identical mail pushes enqueue once and return the first record")
    void gmailPush_replay_returnsFirstRecord() {
        IngestionResult first = service.ingestGmailPush(new HttpHeaders(), gmailBody("136969", 1));
        IngestionResult second = service.ingestGmailPush(new HttpHeaders(), gmailBody("136969", 1));

        assertEquals(IngestionStatus.ENQUEUED, first.getStatus());
        assertFalse(first.isDuplicate());
        assertEquals("136969_1", first.getIdempotencyKey());
        assertEquals("q-1", first.getQueueItemId());
        assertTrue(second.isDuplicate());
        assertSame(first.getRecord(), second.getRecord());
        verify(leaseQueue, times(1)).enqueue(eq(WebhookIngestionService.GMAIL_HISTORY),
                eq(Map.of("emailAddress", "a@x.com", "historyId", "120")), eq("gmail:a@x.com:120"));
        assertTrue(markers.contains("pubsub:136969"));
        assertTrue(markers.contains("gmail:a@x.com:120"));
    }

    @Test
    @DisplayName("Redelivery under a new attempt number is caught by the delivery marker")
    void gmailPush_newAttempt_isDuplicate() {
        service.ingestGmailPush(new HttpHeaders(), gmailBody("136969", 1));

        IngestionResult redelivered = service.ingestGmailPush(new HttpHeaders(), gmailBody("136969", 2));

        assertEquals(IngestionStatus.DUPLICATE, redelivered.getStatus());
        assertTrue(redelivered.isDuplicate());
        assertEquals("136969_2", redelivered.getIdempotencyKey());
        verify(leaseQueue, times(1)).enqueue(anyString(), anyMap(), anyString());
        assertTrue(guard.isProcessed("136969_2"));
    }

    @Test
    @DisplayName("Push delivery is published for health tracking")
    void gmailPush_publishesDeliveryEvent() {
        service.ingestGmailPush(new HttpHeaders(), gmailBody("136969", 1));

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(event.capture());
        PushDeliveryEvent delivery = (PushDeliveryEvent) event.getValue();
        assertEquals(EventSource.GMAIL_PUSH, delivery.getSource());
        assertEquals(T0, delivery.getReceivedAt());
    }

    @Test
    @DisplayName("Rejected push is neither enqueued nor recorded")
    void rejected_isNotRecorded() {
        when(validator.validate(any(HttpHeaders.class), any(), any())).thenReturn(ValidationResult.reject("signature mismatch"));

        IngestionResult result = service.ingestGmailPush(new HttpHeaders(), gmailBody("136969", 1));

        assertTrue(result.isRejected());
        assertEquals("signature mismatch", result.getReason());
        assertFalse(guard.isProcessed("136969_1"));
        verifyNoInteractions(leaseQueue, deduplicationService, eventPublisher);
    }

    @Test
    @DisplayName("Unreadable mail push fails and is reported")
    void gmailPush_malformedBody_fails() {
        IngestionResult result = service.ingestGmailPush(new HttpHeaders(), "{\"message\":{\"messageId\":\"1\"}}");

        assertEquals(IngestionStatus.FAILED, result.getStatus());
        verify(kafkaTemplate).send(eq(FAILURES_TOPIC), isNull(), anyString());
        verifyNoInteractions(leaseQueue);
    }

    @Test
    @DisplayName("Enqueue failure clears markers, reports the failure and is not recorded")
    void enqueueFailure_clearsMarkers() throws Exception {
        when(leaseQueue.enqueue(anyString(), anyMap(), anyString())).thenThrow(new IllegalStateException("database down"));

        IngestionResult result = service.ingestGmailPush(new HttpHeaders(), gmailBody("136969", 1));

        assertEquals(IngestionStatus.FAILED, result.getStatus());
        assertEquals("database down", result.getReason());
        assertFalse(guard.isProcessed("136969_1"));
        verify(deduplicationService).clearDedup("pubsub:136969");
        verify(deduplicationService).clearDedup("gmail:a@x.com:120");
        ArgumentCaptor<String> failure = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(FAILURES_TOPIC), eq("136969"), failure.capture());
        assertEquals("GMAIL_PUSH", objectMapper.readTree(failure.getValue()).get("source").asText());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("Oversized failure payloads are replaced by a stub")
    void slim_truncatesLargePayload() {
        String big = "x".repeat(WebhookIngestionService.MAX_FAILURE_PAYLOAD_CHARS + 1);

        Object slimmed = WebhookIngestionService.slim(big);

        assertEquals(Map.of("note", "truncated", "originalLength", big.length()), slimmed);
        assertEquals("small", WebhookIngestionService.slim("small"));
    }

    @Test
    @DisplayName("Calendar notification is enqueued with channel context")
    void calendar_enqueues() {
        IngestionResult result = service.ingestCalendarNotification(calendarHeaders("42", "exists"), "");

        assertEquals(IngestionStatus.ENQUEUED, result.getStatus());
        assertEquals("ch-1:42_1", result.getIdempotencyKey());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(leaseQueue).enqueue(eq(WebhookIngestionService.CALENDAR_PING), payload.capture(), eq("calendar:ch-1:42"));
        assertEquals("primary", payload.getValue().get("calendarId"));
        assertEquals("exists", payload.getValue().get("resourceState"));
        assertEquals("res-1", payload.getValue().get("resourceId"));
    }

    @Test
    @DisplayName("Replayed calendar message number is a duplicate")
    void calendar_replay_isDuplicate() {
        service.ingestCalendarNotification(calendarHeaders("42", "exists"), "");

        IngestionResult replay = service.ingestCalendarNotification(calendarHeaders("42", "exists"), "");

        assertTrue(replay.isDuplicate());
        assertEquals(IngestionStatus.ENQUEUED, replay.getStatus());
        verify(leaseQueue, times(1)).enqueue(anyString(), anyMap(), anyString());
    }

    @Test
    @DisplayName("Calendar marker already set by another instance yields DUPLICATE")
    void calendar_markerSet_isDuplicate() {
        markers.add("calendar:ch-1:43");

        IngestionResult result = service.ingestCalendarNotification(calendarHeaders("43", "exists"), "");

        assertEquals(IngestionStatus.DUPLICATE, result.getStatus());
        assertTrue(result.isDuplicate());
        verifyNoInteractions(leaseQueue);
    }

    @Test
    @DisplayName("Sync handshake is acknowledged without enqueueing")
    void calendar_sync_isIgnored() {
        IngestionResult result = service.ingestCalendarNotification(calendarHeaders("1", "sync"), "");

        assertEquals(IngestionStatus.IGNORED, result.getStatus());
        assertTrue(guard.isProcessed("ch-1:1_1"));
        verifyNoInteractions(leaseQueue, eventPublisher);
    }

    @Test
    @DisplayName("Calendar notification without a message number fails")
    void calendar_missingMessageNumber_fails() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(WebhookAuthenticityValidator.CHANNEL_ID_HEADER, "ch-1");

        IngestionResult result = service.ingestCalendarNotification(headers, "");

        assertEquals(IngestionStatus.FAILED, result.getStatus());
        verifyNoInteractions(leaseQueue);
    }

    @Test
    @DisplayName("Polled mailbox change shares the push marker")
    void polledGmail_afterPush_isDuplicate() {
        WatchChannel mailbox = WatchChannel.builder().id("gmail_1").provider(WatchProvider.GMAIL)
                .resourceKey("a@x.com").state(ChannelState.ACTIVE).build();
        service.ingestGmailPush(new HttpHeaders(), gmailBody("136969", 1));
        clearInvocations(eventPublisher);

        IngestionResult polled = service.ingestPolled(mailbox, PolledChange.builder().eventId("120").marker("120").build());

        assertEquals(IngestionStatus.DUPLICATE, polled.getStatus());
        verify(leaseQueue, times(1)).enqueue(anyString(), anyMap(), anyString());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("Polled calendar change is enqueued and does not count as a push")
    void polledCalendar_enqueues() {
        PolledChange change = PolledChange.builder().eventId("evt-1").marker("2024-06-10T11:45:00Z").build();

        IngestionResult result = service.ingestPolled(calendarChannel, change);
        IngestionResult again = service.ingestPolled(calendarChannel, change);

        assertEquals(IngestionStatus.ENQUEUED, result.getStatus());
        assertTrue(again.isDuplicate());
        verify(leaseQueue, times(1)).enqueue(eq(WebhookIngestionService.CALENDAR_PING), anyMap(),
                eq("calendar:poll:primary:evt-1:2024-06-10T11:45:00Z"));
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("Enqueued mail push moves the mailbox cursor to its historyId")
    void gmailPush_advancesCheckpoint() {
        service.ingestGmailPush(new HttpHeaders(), gmailBody("136969", 1));
        service.ingestGmailPush(new HttpHeaders(), gmailBody("136969", 2));

        verify(channelManager, times(1)).advanceCheckpoint(WatchResource.gmail("a@x.com"), "120");
    }

    @Test
    @DisplayName("Enqueued calendar notification moves the calendar cursor to the receipt time")
    void calendarNotification_advancesCheckpoint() {
        service.ingestCalendarNotification(calendarHeaders("7", "exists"), "");

        verify(channelManager).advanceCheckpoint(WatchResource.calendar("primary"), T0.toString());
    }

    @Test
    @DisplayName("Polled changes and sync handshakes leave the cursor to the poller")
    void polledAndSync_doNotAdvanceCheckpoint() {
        service.ingestPolled(calendarChannel, PolledChange.builder().eventId("evt-1").marker("2024-06-10T11:45:00Z").build());
        service.ingestCalendarNotification(calendarHeaders("1", "sync"), "");

        verify(channelManager, never()).advanceCheckpoint(any(), any());
    }

    @Test
    @DisplayName("A failing cursor update does not fail the enqueued push")
    void checkpointFailure_keepsEnqueuedResult() {
        doThrow(new IllegalStateException("db down")).when(channelManager).advanceCheckpoint(any(), any());

        IngestionResult result = service.ingestGmailPush(new HttpHeaders(), gmailBody("136969", 1));

        assertEquals(IngestionStatus.ENQUEUED, result.getStatus());
        assertTrue(guard.isProcessed("136969_1"));
    }
}

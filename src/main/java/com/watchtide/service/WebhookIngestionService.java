package com.watchtide.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watchtide.config.WatchtideProperties;
import com.watchtide.dto.IngestionResult;
import com.watchtide.dto.PolledChange;
import com.watchtide.dto.ValidationResult;
import com.watchtide.model.EventSource;
import com.watchtide.model.IngestionStatus;
import com.watchtide.model.ProcessedEventRecord;
import com.watchtide.model.WatchChannel;
import com.watchtide.model.WatchProvider;
import com.watchtide.model.WatchResource;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpHeaders;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The synchronous webhook path, from validation to enqueue.
 *
 * FLOW (per inbound call):
 *   validate ──reject──► REJECTED (403, nothing recorded)
 *      ↓
 *   idempotency ledger hit ──► first call's record, verbatim
 *      ↓
 *   delivery markers (Redis) already set ──► DUPLICATE
 *      ↓
 *   enqueue(type, payload, dedupKey) ──► ENQUEUED
 *      ↓
 *   record outcome, publish PushDeliveryEvent, advance the polling cursor
 *
 * Nothing here throws to the controller. A failed enqueue clears the markers
 * it set, is not recorded, and is published to the webhook failures topic.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIngestionService {

    public static final String GMAIL_HISTORY = "gmail_history";
    public static final String CALENDAR_PING = "calendar_ping";

    static final String RESOURCE_STATE_HEADER = "x-goog-resource-state";
    static final String MESSAGE_NUMBER_HEADER = "x-goog-message-number";
    static final String RESOURCE_ID_HEADER = "x-goog-resource-id";
    static final int MAX_FAILURE_PAYLOAD_CHARS = 40_000;

    private final WebhookAuthenticityValidator validator;
    private final ChannelLifecycleManager channelRegistry;
    private final EventIdempotencyGuard idempotencyGuard;
    private final DeduplicationService deduplicationService;
    private final LeaseQueue leaseQueue;
    private final ApplicationEventPublisher eventPublisher;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final WatchtideProperties properties;
    private final Clock clock;

    /**
     * Mail push body:
     * {
     *   "message": {"messageId": "136969", "data": "<base64 {emailAddress, historyId}>", "publishTime": "..."},
     *   "subscription": "projects/p/subscriptions/s",
     *   "deliveryAttempt": 1
     * }
     */
    public IngestionResult ingestGmailPush(HttpHeaders headers, String rawBody) {
        ValidationResult validation = validator.validate(headers, rawBody, channelRegistry);
        if (!validation.isValid()) {
            return IngestionResult.rejected(validation.getReason());
        }

        GmailNotification notification;
        try {
            notification = parseGmailPush(rawBody);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unreadable mail push body: {}", e.getMessage());
            publishFailure(EventSource.GMAIL_PUSH, null, "Unreadable push body: " + e.getMessage(), rawBody);
            return failed(null, "Unreadable push body");
        }

        String eventId = notification.getMessageId() != null
                ? notification.getMessageId()
                : DeduplicationService.gmailMarker(notification.getEmailAddress(), notification.getHistoryId());
        List<String> markers = new ArrayList<>();
        if (notification.getMessageId() != null) {
            markers.add(DeduplicationService.pubsubMarker(notification.getMessageId()));
        }
        markers.add(DeduplicationService.gmailMarker(notification.getEmailAddress(), notification.getHistoryId()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("emailAddress", notification.getEmailAddress());
        payload.put("historyId", notification.getHistoryId());

        return process(new Delivery(
                EventIdempotencyGuard.deriveKey(eventId, notification.getDeliveryAttempt()),
                eventId, EventSource.GMAIL_PUSH, markers, GMAIL_HISTORY, payload,
                "gmail:" + notification.getEmailAddress() + ":" + notification.getHistoryId(),
                true, rawBody, WatchResource.gmail(notification.getEmailAddress()), notification.getHistoryId()));
    }

    /**
     * Calendar notifications carry everything in headers; the body is empty.
     * resourceState "sync" is the handshake sent right after a watch is
     * created and is acknowledged without enqueueing.
     */
    public IngestionResult ingestCalendarNotification(HttpHeaders headers, String rawBody) {
        ValidationResult validation = validator.validate(headers, rawBody, channelRegistry);
        if (!validation.isValid()) {
            return IngestionResult.rejected(validation.getReason());
        }

        String channelId = headers.getFirst(WebhookAuthenticityValidator.CHANNEL_ID_HEADER);
        String messageNumber = headers.getFirst(MESSAGE_NUMBER_HEADER);
        String resourceState = headers.getFirst(RESOURCE_STATE_HEADER);
        if (channelId == null || messageNumber == null) {
            log.warn("Calendar notification without channel id or message number: channelId={}",
                    WatchChannel.mask(channelId));
            return failed(null, "Missing channel id or message number");
        }

        String eventId = channelId + ":" + messageNumber;
        String key = EventIdempotencyGuard.deriveKey(eventId, 1);

        if ("sync".equalsIgnoreCase(resourceState)) {
            return ignoreSync(key, eventId);
        }

        WatchChannel channel = validation.getChannel();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channelId", channelId);
        payload.put("messageNumber", messageNumber);
        payload.put("resourceState", resourceState);
        payload.put("resourceId", headers.getFirst(RESOURCE_ID_HEADER));
        payload.put("calendarId", channel != null ? channel.getResourceKey() : null);

        return process(new Delivery(key, eventId, EventSource.CALENDAR_WATCH,
                List.of(DeduplicationService.calendarMarker(channelId, messageNumber)),
                CALENDAR_PING, payload, "calendar:" + channelId + ":" + messageNumber,
                true, rawBody, channel != null ? channel.resource() : null, clock.instant().toString()));
    }

    /**
     * A change found by the polling fallback. Shaped like the push event for
     * the same provider so downstream handlers need no special case; does
     * not count as push health.
     */
    public IngestionResult ingestPolled(WatchChannel channel, PolledChange change) {
        if (channel.getProvider() == WatchProvider.GMAIL) {
            String email = channel.getResourceKey();
            String historyId = change.getEventId();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("emailAddress", email);
            payload.put("historyId", historyId);
            String eventId = DeduplicationService.gmailMarker(email, historyId);
            return process(new Delivery(EventIdempotencyGuard.deriveKey(eventId, 1), eventId,
                    EventSource.POLLING_FALLBACK, List.of(eventId), GMAIL_HISTORY, payload,
                    "gmail:" + email + ":" + historyId, false, null, null, null));
        }

        String calendarId = channel.getResourceKey();
        String eventId = "poll:" + calendarId + ":" + change.getEventId() + ":" + change.getMarker();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channelId", channel.getId());
        payload.put("calendarId", calendarId);
        payload.put("eventId", change.getEventId());
        payload.put("updated", change.getMarker());
        payload.put("source", "polling_fallback");
        return process(new Delivery(EventIdempotencyGuard.deriveKey(eventId, 1), eventId,
                EventSource.POLLING_FALLBACK, List.of(), CALENDAR_PING, payload,
                "calendar:" + eventId, false, null, null, null));
    }

    private IngestionResult process(Delivery delivery) {
        Optional<ProcessedEventRecord> cached = idempotencyGuard.getResult(delivery.getKey());
        if (cached.isPresent()) {
            log.info("Already processed, returning recorded outcome: key={}, status={}",
                    delivery.getKey(), cached.get().getStatus());
            return IngestionResult.of(cached.get(), true);
        }

        long started = System.currentTimeMillis();
        List<String> claimed = new ArrayList<>();
        for (String marker : delivery.getMarkers()) {
            if (deduplicationService.isDuplicate(marker)) {
                ProcessedEventRecord record = buildRecord(delivery, IngestionStatus.DUPLICATE, null, true, null, started);
                return finish(delivery, record);
            }
            claimed.add(marker);
        }

        try {
            String queueItemId = leaseQueue.enqueue(delivery.getType(), delivery.getPayload(), delivery.getDedupKey());
            ProcessedEventRecord record = buildRecord(delivery, IngestionStatus.ENQUEUED, queueItemId, true, null, started);
            log.info("Webhook event enqueued: source={}, eventId={}, queueItemId={}",
                    delivery.getSource(), delivery.getEventId(), queueItemId);
            return finish(delivery, record);
        } catch (RuntimeException e) {
            log.error("Enqueue failed: source={}, eventId={}, error={}", delivery.getSource(), delivery.getEventId(), e.getMessage(), e);
            claimed.forEach(deduplicationService::clearDedup);
            publishFailure(delivery.getSource(), delivery.getEventId(), e.getMessage(),
                    delivery.getRawBody() != null ? delivery.getRawBody() : String.valueOf(delivery.getPayload()));
            return IngestionResult.of(buildRecord(delivery, IngestionStatus.FAILED, null, false, e.getMessage(), started), false);
        }
    }

    private IngestionResult ignoreSync(String key, String eventId) {
        Optional<ProcessedEventRecord> cached = idempotencyGuard.getResult(key);
        if (cached.isPresent()) {
            return IngestionResult.of(cached.get(), true);
        }
        ProcessedEventRecord record = ProcessedEventRecord.builder()
                .idempotencyKey(key)
                .eventId(eventId)
                .source(EventSource.CALENDAR_WATCH)
                .status(IngestionStatus.IGNORED)
                .processedAt(clock.instant())
                .success(true)
                .build();
        idempotencyGuard.record(record);
        log.info("Calendar sync notification acknowledged: eventId={}", eventId);
        return IngestionResult.of(record, false);
    }

    private IngestionResult finish(Delivery delivery, ProcessedEventRecord record) {
        idempotencyGuard.record(record);
        if (delivery.isPush()) {
            eventPublisher.publishEvent(new PushDeliveryEvent(delivery.getSource(), delivery.getEventId(), record.getProcessedAt()));
            if (record.getStatus() == IngestionStatus.ENQUEUED && delivery.getResource() != null) {
                advanceCheckpoint(delivery);
            }
        }
        return IngestionResult.of(record, false);
    }

    private void advanceCheckpoint(Delivery delivery) {
        try {
            channelRegistry.advanceCheckpoint(delivery.getResource(), delivery.getCheckpoint());
        } catch (RuntimeException e) {
            // The item is already enqueued; a stale cursor only means polling re-lists it
            log.warn("Checkpoint advance failed: resource={}, error={}", delivery.getResource(), e.getMessage());
        }
    }

    private ProcessedEventRecord buildRecord(Delivery delivery, IngestionStatus status, String queueItemId,
                                             boolean success, String error, long started) {
        return ProcessedEventRecord.builder()
                .idempotencyKey(delivery.getKey())
                .eventId(delivery.getEventId())
                .source(delivery.getSource())
                .status(status)
                .queueItemId(queueItemId)
                .processedAt(clock.instant())
                .success(success)
                .errorMessage(error)
                .processingTimeMs(System.currentTimeMillis() - started)
                .build();
    }

    private IngestionResult failed(String key, String reason) {
        return IngestionResult.builder()
                .status(IngestionStatus.FAILED)
                .idempotencyKey(key)
                .reason(reason)
                .build();
    }

    GmailNotification parseGmailPush(String rawBody) throws JsonProcessingException {
        if (rawBody == null || rawBody.isBlank()) {
            throw new IllegalArgumentException("empty body");
        }
        JsonNode root = objectMapper.readTree(rawBody);
        JsonNode message = root.path("message").isObject() ? root.path("message") : root;

        String messageId = text(message, "messageId");
        if (messageId == null) {
            messageId = text(message, "message_id");
        }
        String data = text(message, "data");
        if (data == null) {
            throw new IllegalArgumentException("missing message data");
        }
        JsonNode decoded = objectMapper.readTree(new String(Base64.getDecoder().decode(data), StandardCharsets.UTF_8));
        String emailAddress = text(decoded, "emailAddress");
        String historyId = text(decoded, "historyId");
        if (emailAddress == null || historyId == null) {
            throw new IllegalArgumentException("message data lacks emailAddress or historyId");
        }
        int deliveryAttempt = root.path("deliveryAttempt").asInt(1);
        return new GmailNotification(messageId, emailAddress, historyId, Math.max(1, deliveryAttempt));
    }

    private void publishFailure(EventSource source, String eventId, String reason, String rawPayload) {
        try {
            Map<String, Object> failure = new HashMap<>();
            failure.put("source", source.name());
            failure.put("eventId", eventId);
            failure.put("error", reason);
            failure.put("payload", slim(rawPayload));
            failure.put("timestamp", clock.millis());
            kafkaTemplate.send(properties.getTopics().getWebhookFailures(), eventId, objectMapper.writeValueAsString(failure));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to record webhook failure: eventId={}, error={}", eventId, e.getMessage(), e);
        }
    }

    static Object slim(String rawPayload) {
        if (rawPayload == null) {
            return null;
        }
        if (rawPayload.length() <= MAX_FAILURE_PAYLOAD_CHARS) {
            return rawPayload;
        }
        Map<String, Object> stub = new LinkedHashMap<>();
        stub.put("note", "truncated");
        stub.put("originalLength", rawPayload.length());
        return stub;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    @Value
    static class GmailNotification {
        String messageId;
        String emailAddress;
        String historyId;
        int deliveryAttempt;
    }

    @Value
    private static class Delivery {
        String key;
        String eventId;
        EventSource source;
        List<String> markers;
        String type;
        Map<String, Object> payload;
        String dedupKey;
        boolean push;
        String rawBody;
        WatchResource resource;
        String checkpoint;
    }
}

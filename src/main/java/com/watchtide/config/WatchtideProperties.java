package com.watchtide.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralizes every tunable of the ingestion core.
 *
 * Bound from application.yml under the "watchtide" prefix:
 *   watchtide:
 *     webhook:
 *       shared-secret: ${WEBHOOK_SECRET:}
 *       replay-tolerance: 5m
 *     channels:
 *       renewal-advance: 1h
 *       calendar-ids: [primary]
 *     health:
 *       stale-threshold: 10m
 *     queue:
 *       lease-duration: 60s
 *       max-batch-size: 10
 *
 * Scheduled methods read their intervals from this bean through SpEL
 * (e.g. "#{@watchtideProperties.queue.pollInterval.toMillis()}"), so there
 * is exactly one place where a default lives.
 */
@Component
@ConfigurationProperties(prefix = "watchtide")
@Getter
@Setter
public class WatchtideProperties {

    private Webhook webhook = new Webhook();
    private Channels channels = new Channels();
    private Health health = new Health();
    private Queue queue = new Queue();
    private Idempotency idempotency = new Idempotency();
    private Dedup dedup = new Dedup();
    private Topics topics = new Topics();
    private Dlq dlq = new Dlq();
    private Google google = new Google();
    private Admin admin = new Admin();

    @Getter
    @Setter
    public static class Webhook {
        /** HMAC-SHA256 key for signed mail push payloads. Blank disables the signature check. */
        private String sharedSecret = "";
        /** Expected channel token for channels persisted without one. */
        private String channelTokenFallbackSecret = "";
        private Duration replayTolerance = Duration.ofMinutes(5);
        /** Public base URL providers call back on, e.g. https://hooks.example.com */
        private String callbackBaseUrl = "";
    }

    @Getter
    @Setter
    public static class Channels {
        private Duration calendarTtl = Duration.ofDays(7);
        private Duration gmailTtl = Duration.ofDays(7);
        private Duration renewalAdvance = Duration.ofHours(1);
        private Duration renewalRetryBackoff = Duration.ofMinutes(5);
        private Duration healthCheckInterval = Duration.ofMinutes(10);
        private List<String> calendarIds = new ArrayList<>();
        private List<String> gmailAddresses = new ArrayList<>();
        /** Pub/Sub topic the mail provider pushes to, e.g. projects/p/topics/agent-gmail */
        private String gmailTopic = "";
        private boolean bootstrapOnStartup = true;
        private boolean stopOnShutdown = true;
    }

    @Getter
    @Setter
    public static class Health {
        private Duration checkInterval = Duration.ofMinutes(5);
        private Duration staleThreshold = Duration.ofMinutes(10);
        private Duration pollingInterval = Duration.ofMinutes(2);
    }

    @Getter
    @Setter
    public static class Queue {
        private Duration leaseDuration = Duration.ofSeconds(60);
        private int maxBatchSize = 10;
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration reclaimInterval = Duration.ofMinutes(1);
        private boolean dispatcherEnabled = true;
    }

    @Getter
    @Setter
    public static class Idempotency {
        private int capacity = 10_000;
        private Duration retention = Duration.ofHours(24);
        private Duration sweepInterval = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Dedup {
        private String keyPrefix = "watchtide:dedup:";
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Topics {
        private String dlq = "watchtide.queue.dlq";
        private String dlqDead = "watchtide.queue.dlq.dead";
        private String webhookFailures = "watchtide.webhook.failures";
        /** Queue item type → task topic, for types without a dedicated handler bean. */
        private Map<String, String> tasks = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Dlq {
        private int maxRetries = 3;
        private long baseDelayMs = 5000;
    }

    @Getter
    @Setter
    public static class Google {
        private String calendarBaseUrl = "https://www.googleapis.com/calendar/v3";
        private String gmailBaseUrl = "https://gmail.googleapis.com/gmail/v1";
        /** Static bearer token; replaced by a real AccessTokenProvider bean in production. */
        private String accessToken = "";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Admin {
        /** When set, /api/admin/** requires a matching X-Internal-Token header. */
        private String internalToken = "";
    }
}

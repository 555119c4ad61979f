package com.watchtide.service;

import com.watchtide.config.WatchtideProperties;
import com.watchtide.dto.ValidationResult;
import com.watchtide.model.WatchChannel;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Decides whether an inbound webhook call really comes from the provider.
 *
 * Two schemes, picked by the headers present:
 *   - channel token: x-goog-channel-id names a tracked channel, which must be
 *     live, and x-goog-channel-token must equal its stored token
 *   - signature: X-Webhook-Signature carries hex HMAC-SHA256 under the shared
 *     secret ("sha256=" prefix optional) of the raw body, or of
 *     {@code timestamp + "." + body} when X-Webhook-Timestamp is sent
 *
 * Either way, an X-Webhook-Timestamp header (epoch seconds) must fall within
 * the replay tolerance. Body fields such as publishTime survive broker
 * redelivery and are not treated as replay timestamps.
 * Comparisons are constant-time; logs carry masked identifiers only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookAuthenticityValidator {

    public static final String CHANNEL_ID_HEADER = "x-goog-channel-id";
    public static final String CHANNEL_TOKEN_HEADER = "x-goog-channel-token";
    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";
    private static final String SIGNATURE_PREFIX = "sha256=";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final WatchtideProperties properties;
    private final Clock clock;

    @PostConstruct
    void warnIfUnsigned() {
        if (isBlank(properties.getWebhook().getSharedSecret())) {
            log.warn("watchtide.webhook.shared-secret is not set; signed push payloads are accepted without a signature check");
        }
    }

    public ValidationResult validate(HttpHeaders headers, String rawBody, ChannelRegistry channelRegistry) {
        String channelId = headers.getFirst(CHANNEL_ID_HEADER);
        ValidationResult result = channelId != null
                ? validateChannelToken(channelId, headers.getFirst(CHANNEL_TOKEN_HEADER), channelRegistry)
                : validateSignature(headers.getFirst(SIGNATURE_HEADER), headers.getFirst(TIMESTAMP_HEADER), rawBody);
        if (!result.isValid()) {
            log.warn("Webhook rejected: reason={}, channelId={}", result.getReason(), WatchChannel.mask(channelId));
            return result;
        }

        Optional<String> replayProblem = checkReplay(headers);
        if (replayProblem.isPresent()) {
            log.warn("Webhook rejected: reason={}, channelId={}", replayProblem.get(), WatchChannel.mask(channelId));
            return ValidationResult.reject(replayProblem.get());
        }
        return result;
    }

    private ValidationResult validateChannelToken(String channelId, String assertedToken,
                                                  ChannelRegistry channelRegistry) {
        Optional<WatchChannel> found = channelRegistry.findChannel(channelId);
        if (found.isEmpty()) {
            return ValidationResult.reject("unknown channel");
        }
        WatchChannel channel = found.get();
        if (!channel.isLiveAt(clock.instant())) {
            return ValidationResult.reject("channel not active");
        }
        String expected = !isBlank(channel.getToken())
                ? channel.getToken()
                : properties.getWebhook().getChannelTokenFallbackSecret();
        if (isBlank(expected)) {
            return ValidationResult.reject("no channel token configured");
        }
        if (assertedToken == null || !constantTimeEquals(expected, assertedToken)) {
            return ValidationResult.reject("channel token mismatch");
        }
        return ValidationResult.accept(channel);
    }

    private ValidationResult validateSignature(String signatureHeader, String timestampHeader, String rawBody) {
        String secret = properties.getWebhook().getSharedSecret();
        if (isBlank(secret)) {
            return ValidationResult.accept(null);
        }
        if (isBlank(signatureHeader)) {
            return ValidationResult.reject("missing signature");
        }
        String provided = signatureHeader.trim().toLowerCase();
        if (provided.startsWith(SIGNATURE_PREFIX)) {
            provided = provided.substring(SIGNATURE_PREFIX.length());
        }
        String expected = sign(secret, signedContent(timestampHeader, rawBody));
        if (!constantTimeEquals(expected, provided)) {
            return ValidationResult.reject("signature mismatch");
        }
        return ValidationResult.accept(null);
    }

    private Optional<String> checkReplay(HttpHeaders headers) {
        String header = headers.getFirst(TIMESTAMP_HEADER);
        if (header == null) {
            return Optional.empty();
        }
        Instant asserted;
        try {
            asserted = Instant.ofEpochSecond(Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            return Optional.of("malformed timestamp");
        }
        Duration skew = Duration.between(asserted, clock.instant()).abs();
        if (skew.compareTo(properties.getWebhook().getReplayTolerance()) > 0) {
            return Optional.of("timestamp outside tolerance");
        }
        return Optional.empty();
    }

    static String signedContent(String timestampHeader, String rawBody) {
        String body = rawBody == null ? "" : rawBody;
        return timestampHeader == null ? body : timestampHeader + "." + body;
    }

    static String sign(String secret, String body) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private static boolean constantTimeEquals(String expected, String provided) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.watchtide.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.watchtide.config.WatchtideProperties;
import com.watchtide.dto.ChangeBatch;
import com.watchtide.dto.PolledChange;
import com.watchtide.dto.WatchRegistration;
import com.watchtide.dto.WatchRequest;
import com.watchtide.model.WatchProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mailbox watch API. Notifications arrive through a Pub/Sub topic, so the
 * channel id and token are local bookkeeping only.
 *
 *   watch → POST {base}/users/{email}/watch  {"topicName": "...", "labelIds": ["INBOX"]}
 *           ← {"historyId": "1234", "expiration": "1718000000000"}
 *   stop  → POST {base}/users/{email}/stop
 *   list  → GET  {base}/users/{email}/history?startHistoryId=...&historyTypes=messageAdded
 *
 * A non-empty history page is reported as a single change carrying the
 * mailbox's latest historyId, the same shape a push notification has.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GmailSubscriptionClient implements SubscriptionClient {

    private final RestTemplate restTemplate;
    private final AccessTokenProvider accessTokenProvider;
    private final WatchtideProperties properties;

    @Override
    public WatchProvider provider() {
        return WatchProvider.GMAIL;
    }

    @Override
    public WatchRegistration watch(WatchRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("topicName", properties.getChannels().getGmailTopic());
        body.put("labelIds", List.of("INBOX"));
        try {
            JsonNode response = restTemplate.postForObject(userUri(request.getResourceKey(), "/watch"),
                    new HttpEntity<>(body, headers()), JsonNode.class);
            if (response == null) {
                throw new SubscriptionApiException(provider(), "watch", "empty response");
            }
            return WatchRegistration.builder()
                    .resourceId(request.getResourceKey())
                    .resourceUri(null)
                    .expiration(GoogleCalendarSubscriptionClient.parseMillis(response.path("expiration").asText(null)))
                    .checkpoint(response.path("historyId").asText(null))
                    .build();
        } catch (RestClientException e) {
            throw new SubscriptionApiException(provider(), "watch", e);
        }
    }

    @Override
    public void stop(String channelId, String resourceId, String emailAddress) {
        try {
            restTemplate.postForEntity(userUri(emailAddress, "/stop"), new HttpEntity<>(headers()), Void.class);
        } catch (RestClientException e) {
            throw new SubscriptionApiException(provider(), "stop", e);
        }
    }

    /**
     * A cursor too old for the history API (404) is reset to the mailbox's
     * current historyId; changes in the gap are not replayed.
     */
    @Override
    public ChangeBatch listChanges(String emailAddress, String since) {
        try {
            if (since == null) {
                return currentPosition(emailAddress);
            }

            URI uri = UriComponentsBuilder.fromHttpUrl(properties.getGoogle().getGmailBaseUrl())
                    .path("/users/{email}/history")
                    .queryParam("startHistoryId", since)
                    .queryParam("historyTypes", "messageAdded")
                    .buildAndExpand(emailAddress)
                    .encode()
                    .toUri();
            JsonNode response;
            try {
                response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers()), JsonNode.class)
                        .getBody();
            } catch (HttpClientErrorException.NotFound e) {
                log.warn("Mailbox history cursor expired, resetting to current position: since={}", since);
                return currentPosition(emailAddress);
            }
            if (response == null) {
                return new ChangeBatch(List.of(), since);
            }
            String latest = response.path("historyId").asText(since);
            if (!response.path("history").isArray() || response.path("history").isEmpty()) {
                return new ChangeBatch(List.of(), latest);
            }
            log.debug("Listed mailbox history: since={}, latest={}", since, latest);
            return new ChangeBatch(List.of(PolledChange.builder().eventId(latest).marker(latest).build()), latest);
        } catch (RestClientException e) {
            throw new SubscriptionApiException(provider(), "listChanges", e);
        }
    }

    private ChangeBatch currentPosition(String emailAddress) {
        JsonNode profile = restTemplate.exchange(userUri(emailAddress, "/profile"), HttpMethod.GET,
                new HttpEntity<>(headers()), JsonNode.class).getBody();
        String historyId = profile != null ? profile.path("historyId").asText(null) : null;
        return new ChangeBatch(List.of(), historyId);
    }

    private URI userUri(String emailAddress, String suffix) {
        return UriComponentsBuilder.fromHttpUrl(properties.getGoogle().getGmailBaseUrl())
                .path("/users/{email}" + suffix)
                .buildAndExpand(emailAddress)
                .encode()
                .toUri();
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String token = accessTokenProvider.accessToken(provider());
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }
        return headers;
    }
}

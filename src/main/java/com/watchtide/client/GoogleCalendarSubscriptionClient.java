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
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calendar events watch API.
 *
 *   watch → POST {base}/calendars/{calendarId}/events/watch
 *           {"id": "...", "type": "web_hook", "address": "...", "token": "...", "expiration": "1718000000000"}
 *   stop  → POST {base}/channels/stop   {"id": "...", "resourceId": "..."}
 *   list  → GET  {base}/calendars/{calendarId}/events?updatedMin=...&showDeleted=true&orderBy=updated
 *
 * The change cursor is an RFC 3339 instant: the latest "updated" seen.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GoogleCalendarSubscriptionClient implements SubscriptionClient {

    static final Duration INITIAL_LOOKBACK = Duration.ofHours(1);

    private final RestTemplate restTemplate;
    private final AccessTokenProvider accessTokenProvider;
    private final WatchtideProperties properties;
    private final Clock clock;

    @Override
    public WatchProvider provider() {
        return WatchProvider.CALENDAR;
    }

    @Override
    public WatchRegistration watch(WatchRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", request.getChannelId());
        body.put("type", "web_hook");
        body.put("address", request.getAddress());
        body.put("token", request.getToken());
        body.put("expiration", String.valueOf(request.getExpiration().toEpochMilli()));

        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl())
                .path("/calendars/{calendarId}/events/watch")
                .buildAndExpand(request.getResourceKey())
                .encode()
                .toUri();
        try {
            JsonNode response = restTemplate.postForObject(uri, new HttpEntity<>(body, headers()), JsonNode.class);
            if (response == null) {
                throw new SubscriptionApiException(provider(), "watch", "empty response");
            }
            return WatchRegistration.builder()
                    .resourceId(response.path("resourceId").asText(null))
                    .resourceUri(response.path("resourceUri").asText(null))
                    .expiration(parseMillis(response.path("expiration").asText(null)))
                    .checkpoint(clock.instant().toString())
                    .build();
        } catch (RestClientException e) {
            throw new SubscriptionApiException(provider(), "watch", e);
        }
    }

    @Override
    public void stop(String channelId, String resourceId, String resourceKey) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", channelId);
        body.put("resourceId", resourceId);
        try {
            restTemplate.postForEntity(baseUrl() + "/channels/stop", new HttpEntity<>(body, headers()), Void.class);
        } catch (RestClientException e) {
            throw new SubscriptionApiException(provider(), "stop", e);
        }
    }

    /**
     * A cursor the API rejects as too old (410) is dropped and the listing
     * restarts from the initial lookback.
     */
    @Override
    public ChangeBatch listChanges(String calendarId, String since) {
        String updatedMin = since != null ? since : clock.instant().minus(INITIAL_LOOKBACK).toString();
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl())
                .path("/calendars/{calendarId}/events")
                .queryParam("updatedMin", updatedMin)
                .queryParam("showDeleted", true)
                .queryParam("singleEvents", true)
                .queryParam("orderBy", "updated")
                .buildAndExpand(calendarId)
                .encode()
                .toUri();
        try {
            JsonNode response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers()), JsonNode.class)
                    .getBody();
            List<PolledChange> changes = new ArrayList<>();
            String latest = updatedMin;
            if (response != null) {
                for (JsonNode item : response.path("items")) {
                    String updated = item.path("updated").asText(null);
                    changes.add(PolledChange.builder()
                            .eventId(item.path("id").asText())
                            .marker(updated)
                            .build());
                    if (updated != null && Instant.parse(updated).isAfter(Instant.parse(latest))) {
                        latest = updated;
                    }
                }
            }
            log.debug("Listed calendar changes: calendarId={}, since={}, changes={}", calendarId, updatedMin, changes.size());
            return new ChangeBatch(changes, latest);
        } catch (HttpClientErrorException.Gone e) {
            if (since == null) {
                throw new SubscriptionApiException(provider(), "listChanges", e);
            }
            log.warn("Calendar change cursor rejected as too old, re-listing from lookback: calendarId={}, since={}",
                    calendarId, since);
            return listChanges(calendarId, null);
        } catch (RestClientException e) {
            throw new SubscriptionApiException(provider(), "listChanges", e);
        }
    }

    private String baseUrl() {
        return properties.getGoogle().getCalendarBaseUrl();
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

    static Instant parseMillis(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Instant.ofEpochMilli(Long.parseLong(value));
    }
}

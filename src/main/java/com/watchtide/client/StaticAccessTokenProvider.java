package com.watchtide.client;

import com.watchtide.config.WatchtideProperties;
import com.watchtide.model.WatchProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads the token from watchtide.google.access-token. Suitable for local runs
 * and deployments where a sidecar refreshes the configured value.
 */
@Component
@RequiredArgsConstructor
public class StaticAccessTokenProvider implements AccessTokenProvider {

    private final WatchtideProperties properties;

    @Override
    public String accessToken(WatchProvider provider) {
        return properties.getGoogle().getAccessToken();
    }
}

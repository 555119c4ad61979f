package com.watchtide.client;

import com.watchtide.model.WatchProvider;

/**
 * Supplies the bearer token used on provider API calls.
 */
public interface AccessTokenProvider {

    String accessToken(WatchProvider provider);
}

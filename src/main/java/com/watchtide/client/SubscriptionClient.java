package com.watchtide.client;

import com.watchtide.dto.ChangeBatch;
import com.watchtide.dto.WatchRegistration;
import com.watchtide.dto.WatchRequest;
import com.watchtide.model.WatchProvider;

/**
 * A provider's subscription API: open a push channel, close it, and list
 * changes since a cursor for the polling fallback.
 *
 * Implementations throw SubscriptionApiException on any remote failure.
 */
public interface SubscriptionClient {

    WatchProvider provider();

    WatchRegistration watch(WatchRequest request);

    void stop(String channelId, String resourceId, String resourceKey);

    /**
     * @param since cursor from the previous call or from watch(); null asks
     *              the provider for a fresh starting point
     */
    ChangeBatch listChanges(String resourceKey, String since);
}

package com.watchtide.client;

import com.watchtide.model.WatchProvider;
import lombok.Getter;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;

@Getter
public class SubscriptionApiException extends RuntimeException {

    private final WatchProvider provider;
    private final String operation;
    /** HTTP status returned by the provider, or 0 when no response arrived. */
    private final int statusCode;

    public SubscriptionApiException(WatchProvider provider, String operation, RestClientException cause) {
        super(provider + " " + operation + " failed: " + cause.getMessage(), cause);
        this.provider = provider;
        this.operation = operation;
        this.statusCode = cause instanceof HttpStatusCodeException
                ? ((HttpStatusCodeException) cause).getStatusCode().value()
                : 0;
    }

    public SubscriptionApiException(WatchProvider provider, String operation, String message) {
        super(provider + " " + operation + " failed: " + message);
        this.provider = provider;
        this.operation = operation;
        this.statusCode = 0;
    }
}

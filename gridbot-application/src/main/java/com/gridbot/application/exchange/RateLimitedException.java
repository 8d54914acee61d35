package com.gridbot.application.exchange;

import java.time.Duration;

/**
 * Exchange kept answering with rate-limit responses past the client's wait budget.
 */
public class RateLimitedException extends ExchangeException {

    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}

package com.stockanalysis.exception;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * The broker rejected a call because the endpoint's rate limit was exceeded.
 * Carries the server-suggested retry delay when the response included one.
 */
public class RateLimitException extends MarketDataException {

    private final Duration retryAfter;

    public RateLimitException(String message) {
        this(message, null);
    }

    public RateLimitException(String message, Duration retryAfter) {
        super(
                ErrorCode.RATE_LIMITED,
                message,
                retryAfter != null ? Map.of("retryAfterMillis", retryAfter.toMillis()) : Map.of());
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}

package dev.autoresume.exception;

import java.time.Duration;

/** Exception thrown when an upstream API refuses further requests until its budget resets. */
public class RateLimitedException extends FetchException {

    private final Duration retryAfter;

    public RateLimitedException(String message, int status, Duration retryAfter) {
        super(message, status, true);
        this.retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}

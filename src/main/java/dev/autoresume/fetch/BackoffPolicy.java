package dev.autoresume.fetch;

import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Bounded exponential backoff shared by every retrying call site.
 * The n-th retry (0-based) waits {@code min(baseDelay * 2^n, maxDelay)}, no jitter.
 */
public final class BackoffPolicy {

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Predicate<Throwable> retryable;

    public BackoffPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, Predicate<Throwable> retryable) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.retryable = retryable;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }

    public Duration delayFor(int retryIndex) {
        long factor = 1L << Math.min(retryIndex, 30);
        Duration delay = baseDelay.multipliedBy(factor);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    /**
     * Reactor retry spec for this policy. Once retries are exhausted the last
     * failure is propagated as-is, so callers see the original error type.
     */
    public RetryBackoffSpec toRetry(Consumer<Retry.RetrySignal> beforeRetry) {
        return Retry.backoff(maxRetries, baseDelay)
                .maxBackoff(maxDelay)
                .jitter(0d)
                .filter(retryable)
                .doBeforeRetry(beforeRetry)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}

package com.chunkr.retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Exponential backoff policy. Pure: it never sleeps, it only answers whether the attempt that just
 * failed should be followed by another one and after how long.
 */
public final class RetryPolicy {
    private final int maxRetries;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Predicate<Throwable> retryable;

    public RetryPolicy(int maxRetries, Duration initialBackoff, Duration maxBackoff, Predicate<Throwable> retryable) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.retryable = retryable;
    }

    public RetryPolicy withRetryable(Predicate<Throwable> retryable) {
        return new RetryPolicy(maxRetries, initialBackoff, maxBackoff, retryable);
    }

    /**
     * @param attempt 1-based number of the attempt that just failed
     * @param cause   the failure of that attempt
     */
    public RetryDecision decide(int attempt, Throwable cause) {
        if (cause instanceof ValidationException) {
            return RetryDecision.giveUp("validation failure");
        }
        if (!retryable.test(cause)) {
            return RetryDecision.giveUp("non-retryable failure");
        }
        if (attempt > maxRetries) {
            return RetryDecision.exhausted(attempt);
        }
        return RetryDecision.retryAfter(backoff(attempt));
    }

    public Duration backoff(int attempt) {
        long capMs = maxBackoff.toMillis();
        long delayMs = initialBackoff.toMillis();
        for (int i = 1; i < attempt && delayMs < capMs; i++) {
            delayMs = delayMs > Long.MAX_VALUE / 2 ? Long.MAX_VALUE : delayMs * 2;
        }
        return Duration.ofMillis(Math.min(delayMs, capMs));
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public int maxRetries() {
        return maxRetries;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxRetries=" + maxRetries +
                ", initialBackoff=" + initialBackoff +
                ", maxBackoff=" + maxBackoff +
                '}';
    }
}

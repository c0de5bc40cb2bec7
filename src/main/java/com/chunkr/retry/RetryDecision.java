package com.chunkr.retry;

import java.time.Duration;

/**
 * @param exhausted true when the failure was retryable but the attempt budget is spent
 */
public record RetryDecision(boolean retry, Duration delay, boolean exhausted, String reason) {
    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay, false, "");
    }

    public static RetryDecision giveUp(String reason) {
        return new RetryDecision(false, Duration.ZERO, false, reason);
    }

    public static RetryDecision exhausted(int attempts) {
        return new RetryDecision(false, Duration.ZERO, true, "retries exhausted after " + attempts + " attempts");
    }
}

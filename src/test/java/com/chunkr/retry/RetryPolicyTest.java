package com.chunkr.retry;

import java.io.IOException;
import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(500), Duration.ofMillis(30_000),
            cause -> cause instanceof IOException);

    @Test
    void shouldDoubleBackoffPerAttempt() {
        assertEquals(Duration.ofMillis(500), policy.backoff(1));
        assertEquals(Duration.ofMillis(1000), policy.backoff(2));
        assertEquals(Duration.ofMillis(2000), policy.backoff(3));
        assertEquals(Duration.ofMillis(8000), policy.backoff(5));
    }

    @Test
    void shouldCapBackoffWithoutOverflowing() {
        assertEquals(Duration.ofMillis(30_000), policy.backoff(7));
        assertEquals(Duration.ofMillis(30_000), policy.backoff(200));
    }

    @Test
    void shouldRetryTransientFailuresUntilBudgetIsSpent() {
        for (int attempt = 1; attempt <= 5; attempt++) {
            RetryDecision decision = policy.decide(attempt, new IOException("timeout"));
            assertTrue(decision.retry(), "attempt " + attempt);
            assertEquals(policy.backoff(attempt), decision.delay());
        }

        RetryDecision last = policy.decide(6, new IOException("timeout"));
        assertFalse(last.retry());
        assertTrue(last.exhausted());
        assertEquals(6, policy.maxAttempts());
    }

    @Test
    void shouldNeverRetryValidationFailures() {
        RetryPolicy retryAll = policy.withRetryable(cause -> true);

        RetryDecision decision = retryAll.decide(1, new ValidationException("dimension mismatch"));

        assertFalse(decision.retry());
        assertFalse(decision.exhausted());
    }

    @Test
    void shouldGiveUpOnNonRetryableCause() {
        RetryDecision decision = policy.decide(1, new IllegalStateException("bad request"));

        assertFalse(decision.retry());
        assertFalse(decision.exhausted());
    }

    @Test
    void shouldMakeExactlyOneAttemptWithZeroRetries() {
        RetryPolicy once = new RetryPolicy(0, Duration.ZERO, Duration.ZERO, cause -> true);

        assertEquals(1, once.maxAttempts());
        assertTrue(once.decide(1, new IOException("x")).exhausted());
    }

    @Test
    void shouldRejectNegativeRetries() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(-1, Duration.ZERO, Duration.ZERO, cause -> true));
    }
}

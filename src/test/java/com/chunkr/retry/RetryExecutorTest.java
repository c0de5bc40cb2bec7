package com.chunkr.retry;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryExecutorTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), Duration.ofMillis(1000),
            cause -> cause instanceof IOException);
    private final RetryExecutor executor = new RetryExecutor(policy, sleeps::add);

    @Test
    void shouldSucceedAfterTwoTransientFailures() {
        Attempted<String> result = executor.execute("op", attempt -> {
            if (attempt < 3) {
                throw new IOException("flaky " + attempt);
            }
            return "ok";
        });

        assertTrue(result.succeeded());
        assertEquals("ok", result.value());
        assertEquals(3, result.attempts());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void shouldReportExhaustionAfterMaxAttempts() {
        Attempted<String> result = executor.execute("op", attempt -> {
            throw new IOException("down");
        });

        assertFalse(result.succeeded());
        assertTrue(result.exhausted());
        assertEquals(6, result.attempts());
        assertEquals(5, sleeps.size());
        assertEquals(Duration.ofMillis(1000), sleeps.get(4));
    }

    @Test
    void shouldStopImmediatelyOnValidationFailure() {
        Attempted<String> result = executor.execute("op", attempt -> {
            throw new ValidationException("bad");
        });

        assertFalse(result.succeeded());
        assertFalse(result.exhausted());
        assertEquals(1, result.attempts());
        assertTrue(sleeps.isEmpty());
        assertInstanceOf(ValidationException.class, result.failure());
    }

    @Test
    void shouldReturnFailureAndKeepInterruptFlagWhenSleepIsInterrupted() {
        RetryExecutor interrupted = new RetryExecutor(policy, delay -> {
            throw new InterruptedException("stop");
        });

        Attempted<String> result = interrupted.execute("op", attempt -> {
            throw new IOException("down");
        });

        assertFalse(result.succeeded());
        assertEquals(1, result.attempts());
        assertInstanceOf(InterruptedException.class, result.failure());
        assertTrue(Thread.currentThread().isInterrupted());
        Thread.interrupted();
    }
}

package com.chunkr.retry;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation until it succeeds or the {@link RetryPolicy} gives up. Backoff sleeps go through
 * the injected {@link Sleeper}; they are not cut short by a graceful stop, only by thread interruption.
 */
public class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public <T> Attempted<T> execute(String operation, RetryableOperation<T> body) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return Attempted.success(body.run(attempt), attempt);
            } catch (Exception e) {
                RetryDecision decision = policy.decide(attempt, e);
                if (!decision.retry()) {
                    log.warn("retry.giveup op={} attempt={} reason={} cause={}",
                            operation, attempt, decision.reason(), e.toString());
                    return Attempted.failed(e, attempt, decision.exhausted());
                }
                Duration delay = decision.delay();
                log.warn("retry.scheduled op={} attempt={} maxAttempts={} backoffMs={} cause={}",
                        operation, attempt, policy.maxAttempts(), delay.toMillis(), e.toString());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    interrupted.addSuppressed(e);
                    return Attempted.failed(interrupted, attempt, false);
                }
            }
        }
    }

    @FunctionalInterface
    public interface RetryableOperation<T> {
        T run(int attempt) throws Exception;
    }
}

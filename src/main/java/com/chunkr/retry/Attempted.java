package com.chunkr.retry;

/**
 * Result of running an operation under a {@link RetryPolicy}.
 *
 * @param attempts  how many times the operation was invoked
 * @param exhausted true when the last failure was retryable but no attempts were left
 */
public record Attempted<T>(T value, int attempts, Throwable failure, boolean exhausted) {

    public static <T> Attempted<T> success(T value, int attempts) {
        return new Attempted<>(value, attempts, null, false);
    }

    public static <T> Attempted<T> failed(Throwable failure, int attempts, boolean exhausted) {
        return new Attempted<>(null, attempts, failure, exhausted);
    }

    public boolean succeeded() {
        return failure == null;
    }
}

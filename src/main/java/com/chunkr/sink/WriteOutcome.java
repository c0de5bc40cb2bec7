package com.chunkr.sink;

/**
 * Final result of writing one batch to one sink.
 *
 * @param attempts write calls actually issued to the sink; 0 when the batch failed validation
 */
public record WriteOutcome(Sink sink, Status status, int attempts, Throwable cause) {

    public enum Status {
        COMMITTED,
        RETRYABLE_FAILURE,
        FATAL_FAILURE
    }

    public static WriteOutcome committed(Sink sink, int attempts) {
        return new WriteOutcome(sink, Status.COMMITTED, attempts, null);
    }

    public static WriteOutcome retryableFailure(Sink sink, int attempts, Throwable cause) {
        return new WriteOutcome(sink, Status.RETRYABLE_FAILURE, attempts, cause);
    }

    public static WriteOutcome fatalFailure(Sink sink, int attempts, Throwable cause) {
        return new WriteOutcome(sink, Status.FATAL_FAILURE, attempts, cause);
    }

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }

    public String causeMessage() {
        return cause == null ? "" : String.valueOf(cause.getMessage());
    }
}

package com.chunkr.sink;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;

public class SinkHttpException extends IOException {
    private final int status;

    public SinkHttpException(String message, int status) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }

    /**
     * Timeouts, throttling and server errors; any other non-success status will fail again.
     */
    public boolean isTransient() {
        return status == 408 || status == 429 || status >= 500;
    }

    /**
     * Transient HTTP statuses and transport errors. A payload Jackson cannot serialize fails the same
     * way on every attempt.
     */
    public static boolean isRetryable(Throwable cause) {
        if (cause instanceof SinkHttpException http) {
            return http.isTransient();
        }
        if (cause instanceof JsonProcessingException) {
            return false;
        }
        return cause instanceof IOException;
    }
}

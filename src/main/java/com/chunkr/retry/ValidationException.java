package com.chunkr.retry;

/**
 * Input that can never succeed on a retry: a malformed chunk record or a vector whose
 * dimensionality differs from the configured collection.
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

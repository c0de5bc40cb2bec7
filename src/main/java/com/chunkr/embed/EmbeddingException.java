package com.chunkr.embed;

import java.io.IOException;

/**
 * Non-success status or unusable body from the embedding provider. Always worth a retry.
 */
public class EmbeddingException extends IOException {
    private final int status;

    public EmbeddingException(String message) {
        this(message, -1);
    }

    public EmbeddingException(String message, int status) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}

package com.chunkr.embed;

import java.io.IOException;
import java.util.List;

/**
 * One request to an embedding backend: ordered texts in, equally ordered vectors out.
 */
public interface EmbeddingProvider {
    List<float[]> embed(List<String> texts) throws IOException;

    String name();

    /**
     * Embeds a single short text once, without retries, so an unreachable or misconfigured backend
     * is reported before any sink is written.
     */
    default void checkReachable() throws IOException {
        List<float[]> vectors = embed(List.of("ping"));
        if (vectors.size() != 1) {
            throw new EmbeddingException(name() + " returned " + vectors.size() + " vectors for 1 input");
        }
    }
}

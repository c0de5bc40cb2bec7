package com.chunkr.embed;

import java.util.Collections;
import java.util.List;

/**
 * Vectors for one {@link EmbeddingClient#embed} call, positionally aligned with its input. Texts whose
 * sub-batch failed have a {@code null} slot and are covered by exactly one {@link SubBatchFailure}.
 */
public record EmbeddingResult(List<float[]> vectors, List<SubBatchFailure> failures) {

    public EmbeddingResult {
        vectors = Collections.unmodifiableList(vectors);
        failures = List.copyOf(failures);
    }

    public boolean complete() {
        return failures.isEmpty();
    }

    public float[] vector(int index) {
        return vectors.get(index);
    }

    public SubBatchFailure failureFor(int index) {
        for (SubBatchFailure failure : failures) {
            if (index >= failure.fromIndex() && index < failure.toIndex()) {
                return failure;
            }
        }
        return null;
    }

    /**
     * @param fromIndex inclusive
     * @param toIndex   exclusive
     */
    public record SubBatchFailure(int fromIndex, int toIndex, int attempts, Throwable cause) {
    }
}

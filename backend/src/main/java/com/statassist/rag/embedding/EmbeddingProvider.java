package com.statassist.rag.embedding;

/**
 * Maps text to a fixed-length vector.
 * <p>
 * Implementations must be deterministic for identical input. Failures surface as
 * {@link com.statassist.rag.exception.EmbeddingException}.
 */
public interface EmbeddingProvider {

    float[] embed(String text);

    /** Short label used in logs and health output. */
    default String describe() {
        return getClass().getSimpleName();
    }
}

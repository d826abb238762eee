package com.statassist.rag.exception;

/**
 * The embedding provider failed to produce a vector for a text.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}

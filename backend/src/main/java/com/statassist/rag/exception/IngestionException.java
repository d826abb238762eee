package com.statassist.rag.exception;

/**
 * A dataset could not be indexed. No collection is left behind for the session.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}

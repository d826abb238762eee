package com.statassist.rag.exception;

/**
 * Uploaded data could not be parsed into a dataset.
 */
public class InvalidDatasetException extends RuntimeException {

    public InvalidDatasetException(String message) {
        super(message);
    }

    public InvalidDatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}

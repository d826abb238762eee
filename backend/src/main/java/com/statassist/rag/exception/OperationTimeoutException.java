package com.statassist.rag.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * A retrieval operation ran past its deadline.
 */
@Getter
public class OperationTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    public OperationTimeoutException(String operation, Duration timeout) {
        super(String.format("%s exceeded its deadline of %dms", operation, timeout.toMillis()));
        this.operation = operation;
        this.timeout = timeout;
    }
}

package com.statassist.rag.exception;

/**
 * A caller supplied a missing or malformed argument, such as a blank session id or an
 * unknown chunk type.
 */
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(String message) {
        super(message);
    }
}

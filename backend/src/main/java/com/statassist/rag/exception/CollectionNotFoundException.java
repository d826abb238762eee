package com.statassist.rag.exception;

import lombok.Getter;

/**
 * No collection is indexed for the requested session.
 */
@Getter
public class CollectionNotFoundException extends RuntimeException {

    private final String sessionId;

    public CollectionNotFoundException(String sessionId) {
        super("No collection found for session " + sessionId);
        this.sessionId = sessionId;
    }
}

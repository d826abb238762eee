package com.statassist.rag.store;

import lombok.Value;

import java.util.Map;

/**
 * One entry to insert: id, vector, raw document text and flat string metadata.
 */
@Value
public class IndexRecord {

    String id;

    float[] vector;

    String document;

    Map<String, String> metadata;

    public IndexRecord(String id, float[] vector, String document, Map<String, String> metadata) {
        this.id = id;
        this.vector = vector;
        this.document = document;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}

package com.statassist.rag.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of dataset excerpt a {@link DataChunk} carries.
 * The label is what gets written into the vector store metadata.
 */
public enum ChunkType {
    ROW_GROUP("row_group"),
    COLUMN_GROUP("column_group"),
    STATISTICAL_SUMMARY("statistical_summary"),
    CORRELATION_MATRIX("correlation_matrix");

    private final String label;

    ChunkType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Resolve a stored label back to its type; unknown labels yield null.
     */
    public static ChunkType fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (ChunkType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        return null;
    }
}

package com.statassist.rag.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Query classification categories.
 * Only the first seven are produced by pattern matching; the remaining ones exist
 * so callers can route on them and so augmentation/re-ranking tables can name them.
 */
public enum QueryType {
    DESCRIPTIVE("descriptive"),
    INFERENTIAL("inferential"),
    CORRELATION("correlation"),
    VISUALIZATION("visualization"),
    COMPARISON("comparison"),
    PREDICTIVE("predictive"),
    TEMPORAL("temporal"),
    DISTRIBUTION("distribution"),
    OUTLIER("outlier"),
    SUMMARY("summary");

    private final String label;

    QueryType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static QueryType fromLabel(String label) {
        for (QueryType type : values()) {
            if (type.label.equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown query type: " + label);
    }
}

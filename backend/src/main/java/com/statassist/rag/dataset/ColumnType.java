package com.statassist.rag.dataset;

/**
 * Declared type of a dataset column. The label is the dtype name reported in chunk text
 * and {@code data_types} maps.
 */
public enum ColumnType {
    INTEGER("int64", true),
    DECIMAL("float64", true),
    TEXT("object", false);

    private final String label;
    private final boolean numeric;

    ColumnType(String label, boolean numeric) {
        this.label = label;
        this.numeric = numeric;
    }

    public String getLabel() {
        return label;
    }

    public boolean isNumeric() {
        return numeric;
    }
}

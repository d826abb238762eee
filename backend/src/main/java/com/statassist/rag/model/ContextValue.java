package com.statassist.rag.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tagged value used for the free-form statistical context and provenance maps of a chunk.
 * Serialises to plain JSON (string, number, boolean, object, array or null).
 */
@EqualsAndHashCode
public final class ContextValue {

    public enum Kind { TEXT, NUMBER, BOOLEAN, MAP, LIST, NULL }

    private static final ContextValue NULL_VALUE = new ContextValue(Kind.NULL, null);

    @Getter
    private final Kind kind;
    private final Object value;

    private ContextValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static ContextValue of(String text) {
        return text == null ? NULL_VALUE : new ContextValue(Kind.TEXT, text);
    }

    public static ContextValue of(Number number) {
        return number == null ? NULL_VALUE : new ContextValue(Kind.NUMBER, number);
    }

    public static ContextValue of(boolean flag) {
        return new ContextValue(Kind.BOOLEAN, flag);
    }

    public static ContextValue of(Map<String, ContextValue> entries) {
        if (entries == null) {
            return NULL_VALUE;
        }
        return new ContextValue(Kind.MAP, Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    public static ContextValue of(List<ContextValue> items) {
        if (items == null) {
            return NULL_VALUE;
        }
        return new ContextValue(Kind.LIST, List.copyOf(items));
    }

    public static ContextValue nullValue() {
        return NULL_VALUE;
    }

    /** Map of plain numbers keyed by name, e.g. per-column means. */
    public static ContextValue ofNumbers(Map<String, ? extends Number> numbers) {
        Map<String, ContextValue> entries = new LinkedHashMap<>();
        numbers.forEach((key, number) -> entries.put(key, of(number)));
        return of(entries);
    }

    /** Nested map of numbers, e.g. a correlation matrix. */
    public static ContextValue ofNumberTable(Map<String, ? extends Map<String, ? extends Number>> table) {
        Map<String, ContextValue> entries = new LinkedHashMap<>();
        table.forEach((key, row) -> entries.put(key, ofNumbers(row)));
        return of(entries);
    }

    public static ContextValue ofTexts(Map<String, String> texts) {
        Map<String, ContextValue> entries = new LinkedHashMap<>();
        texts.forEach((key, text) -> entries.put(key, of(text)));
        return of(entries);
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public String asText() {
        require(Kind.TEXT);
        return (String) value;
    }

    public Number asNumber() {
        require(Kind.NUMBER);
        return (Number) value;
    }

    public boolean asBoolean() {
        require(Kind.BOOLEAN);
        return (Boolean) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, ContextValue> asMap() {
        require(Kind.MAP);
        return (Map<String, ContextValue>) value;
    }

    @SuppressWarnings("unchecked")
    public List<ContextValue> asList() {
        require(Kind.LIST);
        return (List<ContextValue>) value;
    }

    /**
     * Plain Java representation handed to Jackson.
     */
    @JsonValue
    public Object toJson() {
        switch (kind) {
            case MAP:
                Map<String, Object> map = new LinkedHashMap<>();
                asMap().forEach((key, entry) -> map.put(key, entry.toJson()));
                return map;
            case LIST:
                List<Object> list = new ArrayList<>();
                asList().forEach(entry -> list.add(entry.toJson()));
                return list;
            default:
                return value;
        }
    }

    private void require(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Context value is " + kind + ", not " + expected);
        }
    }

    @Override
    public String toString() {
        return String.valueOf(toJson());
    }
}

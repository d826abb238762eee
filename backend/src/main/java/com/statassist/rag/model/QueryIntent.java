package com.statassist.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Classified meaning of one natural-language query.
 * Built fresh for every classification and never mutated afterwards.
 */
@Value
public class QueryIntent {

    QueryType type;

    Set<String> variables;

    Set<String> operations;

    Map<String, ContextValue> filters;

    /** Share of pattern matches won by {@link #type}; 0.5 when nothing matched. */
    double confidence;

    @JsonProperty("statistical_tests")
    Set<String> statisticalTests;

    /** Chart family token, or null when no visualization pattern matched. */
    @JsonProperty("visualization_type")
    String visualizationType;

    @Builder
    public QueryIntent(QueryType type,
                       Set<String> variables,
                       Set<String> operations,
                       Map<String, ContextValue> filters,
                       double confidence,
                       Set<String> statisticalTests,
                       String visualizationType) {
        this.type = type != null ? type : QueryType.DESCRIPTIVE;
        this.variables = copyOf(variables);
        this.operations = copyOf(operations);
        this.filters = filters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        this.confidence = confidence;
        this.statisticalTests = copyOf(statisticalTests);
        this.visualizationType = visualizationType;
    }

    public Optional<String> visualization() {
        return Optional.ofNullable(visualizationType);
    }

    private static Set<String> copyOf(Set<String> values) {
        return values == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}

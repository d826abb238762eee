package com.statassist.rag.intent;

import com.statassist.rag.model.ContextValue;
import com.statassist.rag.model.QueryIntent;
import com.statassist.rag.model.QueryType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a natural-language question about a dataset into a {@link QueryIntent}.
 * <p>
 * Every vocabulary scan runs independently: the category vote decides the single
 * {@code type}, while variables, operations, filters, statistical tests and chart type
 * are collected on the side for query augmentation and re-ranking.
 * <p>
 * Classification never throws. A blank query, or any failure while matching, yields the
 * fallback intent (descriptive, confidence 0.5).
 */
@Service
@Slf4j
public class QueryIntentClassifier {

    public static final double FALLBACK_CONFIDENCE = 0.5;

    public QueryIntent classify(String query) {
        if (query == null || query.trim().isEmpty()) {
            log.warn("Empty query provided for intent classification, using fallback intent");
            return fallbackIntent();
        }

        try {
            String lowerQuery = query.toLowerCase(Locale.ROOT);

            Map<QueryType, Integer> typeScores = scoreCategories(lowerQuery);

            QueryType primaryType = QueryType.DESCRIPTIVE;
            double confidence = FALLBACK_CONFIDENCE;
            if (!typeScores.isEmpty()) {
                int best = 0;
                int total = 0;
                // EnumMap iterates in declaration order, which is the tie-break priority
                for (Map.Entry<QueryType, Integer> entry : typeScores.entrySet()) {
                    total += entry.getValue();
                    if (entry.getValue() > best) {
                        best = entry.getValue();
                        primaryType = entry.getKey();
                    }
                }
                confidence = (double) best / total;
            }

            QueryIntent intent = QueryIntent.builder()
                    .type(primaryType)
                    .confidence(confidence)
                    .variables(extractVariables(lowerQuery))
                    .operations(matchingKeys(PatternLibrary.OPERATION_PATTERNS, lowerQuery))
                    .filters(extractFilters(lowerQuery))
                    .statisticalTests(matchingKeys(PatternLibrary.STATISTICAL_TEST_PATTERNS, lowerQuery))
                    .visualizationType(firstMatchingKey(PatternLibrary.VISUALIZATION_PATTERNS, lowerQuery))
                    .build();

            log.debug("Classified query '{}' as {} (confidence {}, scores {})",
                    query, intent.getType().getLabel(), String.format("%.2f", confidence), typeScores);
            return intent;

        } catch (RuntimeException e) {
            log.error("Intent classification failed for query '{}': {}", query, e.getMessage(), e);
            return fallbackIntent();
        }
    }

    /**
     * Number of matching patterns per category; categories with no match are absent.
     */
    Map<QueryType, Integer> scoreCategories(String lowerQuery) {
        Map<QueryType, Integer> scores = new EnumMap<>(QueryType.class);
        for (Map.Entry<QueryType, List<Pattern>> category : PatternLibrary.CATEGORY_PATTERNS.entrySet()) {
            for (Pattern pattern : category.getValue()) {
                if (pattern.matcher(lowerQuery).find()) {
                    scores.merge(category.getKey(), 1, Integer::sum);
                }
            }
        }
        return scores;
    }

    private Set<String> extractVariables(String lowerQuery) {
        Set<String> variables = new LinkedHashSet<>();
        for (Pattern pattern : PatternLibrary.VARIABLE_PATTERNS) {
            Matcher matcher = pattern.matcher(lowerQuery);
            while (matcher.find()) {
                variables.add(matcher.group(1));
            }
        }
        return variables;
    }

    private Map<String, ContextValue> extractFilters(String lowerQuery) {
        Map<String, ContextValue> filters = new LinkedHashMap<>();

        Matcher age = PatternLibrary.AGE_FILTER.matcher(lowerQuery);
        if (age.find()) {
            try {
                filters.put("age", ContextValue.of(Long.parseLong(age.group(1))));
            } catch (NumberFormatException e) {
                log.debug("Ignoring out-of-range age filter '{}'", age.group(1));
            }
        }

        Matcher gender = PatternLibrary.GENDER_FILTER.matcher(lowerQuery);
        if (gender.find()) {
            filters.put("gender", ContextValue.of(gender.group(1)));
        }

        Matcher group = PatternLibrary.GROUP_FILTER.matcher(lowerQuery);
        if (group.find()) {
            String value = group.group(1).trim();
            if (!value.isEmpty()) {
                filters.put("group", ContextValue.of(value));
            }
        }

        return filters;
    }

    private static Set<String> matchingKeys(Map<String, Pattern> table, String lowerQuery) {
        Set<String> keys = new LinkedHashSet<>();
        for (Map.Entry<String, Pattern> entry : table.entrySet()) {
            if (entry.getValue().matcher(lowerQuery).find()) {
                keys.add(entry.getKey());
            }
        }
        return keys;
    }

    private static String firstMatchingKey(Map<String, Pattern> table, String lowerQuery) {
        for (Map.Entry<String, Pattern> entry : table.entrySet()) {
            if (entry.getValue().matcher(lowerQuery).find()) {
                return entry.getKey();
            }
        }
        return null;
    }

    public static QueryIntent fallbackIntent() {
        return QueryIntent.builder()
                .type(QueryType.DESCRIPTIVE)
                .confidence(FALLBACK_CONFIDENCE)
                .build();
    }
}

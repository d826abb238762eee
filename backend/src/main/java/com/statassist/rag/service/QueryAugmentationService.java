package com.statassist.rag.service;

import com.statassist.rag.config.QueryAugmentationConfigLoader;
import com.statassist.rag.model.QueryIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Expands a query with vocabulary tied to its intent so that terse questions still embed
 * close to the matching chunks.
 * <p>
 * Flow: query → intent → {@code query + type phrase + " variables: ..." + " statistical tests: ..."}
 */
@Service
@Slf4j
public class QueryAugmentationService {

    private final QueryAugmentationConfigLoader configLoader;

    public QueryAugmentationService(QueryAugmentationConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    public String augment(String query, QueryIntent intent) {
        StringBuilder augmented = new StringBuilder(query == null ? "" : query);

        String phrase = configLoader.getPhrase(intent.getType());
        if (!phrase.isEmpty()) {
            augmented.append(' ').append(phrase);
        }
        if (!intent.getVariables().isEmpty()) {
            augmented.append(" variables: ").append(String.join(" ", intent.getVariables()));
        }
        if (!intent.getStatisticalTests().isEmpty()) {
            augmented.append(" statistical tests: ").append(String.join(" ", intent.getStatisticalTests()));
        }

        String result = augmented.toString().trim();
        log.debug("Query augmented: '{}' → '{}' (type: {})", query, result, intent.getType().getLabel());
        return result;
    }
}

package com.statassist.rag.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.statassist.rag.model.AugmentationTemplate;
import com.statassist.rag.model.QueryType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the per-query-type augmentation phrases from query-augmentation.json at startup.
 * Types the file does not mention, or every type when the file is missing or unreadable,
 * use the built-in phrases.
 */
@Component
@Slf4j
public class QueryAugmentationConfigLoader {

    public static final String DEFAULT_RESOURCE = "/query-augmentation.json";

    static final Map<QueryType, String> BUILT_IN_PHRASES;

    static {
        Map<QueryType, String> phrases = new EnumMap<>(QueryType.class);
        phrases.put(QueryType.DESCRIPTIVE, "statistical summary descriptive statistics mean median mode standard deviation");
        phrases.put(QueryType.INFERENTIAL, "hypothesis testing statistical significance p-value confidence interval");
        phrases.put(QueryType.CORRELATION, "correlation relationship association linear regression");
        phrases.put(QueryType.VISUALIZATION, "plot graph chart visualization data display");
        phrases.put(QueryType.COMPARISON, "comparison group difference statistical test");
        phrases.put(QueryType.PREDICTIVE, "prediction modeling machine learning regression classification");
        phrases.put(QueryType.TEMPORAL, "trend over time change period time series");
        phrases.put(QueryType.DISTRIBUTION, "distribution histogram spread skewness quartiles range");
        phrases.put(QueryType.OUTLIER, "outlier extreme values anomaly quartiles range");
        phrases.put(QueryType.SUMMARY, "dataset overview summary shape missing values data types");
        BUILT_IN_PHRASES = Collections.unmodifiableMap(phrases);
    }

    private final String resource;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private Map<QueryType, String> phrases = new EnumMap<>(BUILT_IN_PHRASES);
    private boolean loaded;

    public QueryAugmentationConfigLoader() {
        this(DEFAULT_RESOURCE);
    }

    public QueryAugmentationConfigLoader(String resource) {
        this.resource = resource;
    }

    @PostConstruct
    public void load() {
        Map<QueryType, String> merged = new EnumMap<>(BUILT_IN_PHRASES);
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                log.error("❌ {} not found in classpath resources!", resource);
                log.warn("⚠️  Using built-in augmentation phrases");
                phrases = merged;
                loaded = false;
                return;
            }

            List<AugmentationTemplate> templates = objectMapper.readValue(
                    is, new TypeReference<List<AugmentationTemplate>>() {});

            int applied = 0;
            for (AugmentationTemplate template : templates) {
                QueryType type = resolveType(template.getQueryType());
                if (type == null || template.getPhrase() == null || template.getPhrase().isBlank()) {
                    log.warn("⚠️  Skipping augmentation entry for query_type '{}'", template.getQueryType());
                    continue;
                }
                merged.put(type, template.getPhrase().trim());
                applied++;
            }

            phrases = merged;
            loaded = true;
            log.info("✅ Loaded {} augmentation phrases from {}", applied, resource);

        } catch (IOException | RuntimeException e) {
            log.error("❌ Error loading {}: {}", resource, e.getMessage(), e);
            log.warn("⚠️  Using built-in augmentation phrases");
            phrases = new EnumMap<>(BUILT_IN_PHRASES);
            loaded = false;
        }
    }

    private static QueryType resolveType(String label) {
        try {
            return QueryType.fromLabel(label);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** Phrase for a query type, never null. */
    public String getPhrase(QueryType type) {
        return phrases.getOrDefault(type, "");
    }

    public boolean isLoaded() {
        return loaded;
    }
}

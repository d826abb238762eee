package com.statassist.rag.config;

import com.statassist.rag.model.ChunkType;
import com.statassist.rag.model.QueryType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Score multipliers applied after vector search: a chunk-type affinity per query type and a
 * bonus when the chunk covers a variable named in the query.
 * <p>
 * The values are hand-tuned and have no derivation; treat them as knobs.
 */
public final class RerankingPolicy {

    public static final double DEFAULT_VARIABLE_OVERLAP_BONUS = 1.3;

    private final Map<QueryType, Map<ChunkType, Double>> affinities;
    private final double variableOverlapBonus;

    private RerankingPolicy(Map<QueryType, Map<ChunkType, Double>> affinities, double variableOverlapBonus) {
        this.affinities = affinities;
        this.variableOverlapBonus = variableOverlapBonus;
    }

    public static RerankingPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder()
                .affinity(QueryType.DESCRIPTIVE, ChunkType.STATISTICAL_SUMMARY, 1.5)
                .affinity(QueryType.DESCRIPTIVE, ChunkType.COLUMN_GROUP, 1.2)
                .affinity(QueryType.CORRELATION, ChunkType.CORRELATION_MATRIX, 1.8)
                .affinity(QueryType.CORRELATION, ChunkType.STATISTICAL_SUMMARY, 1.3)
                .affinity(QueryType.VISUALIZATION, ChunkType.COLUMN_GROUP, 1.4)
                .affinity(QueryType.VISUALIZATION, ChunkType.CORRELATION_MATRIX, 1.3)
                .variableOverlapBonus(DEFAULT_VARIABLE_OVERLAP_BONUS);
    }

    /** Multiplier for a chunk type under a query type; 1.0 when unconfigured. */
    public double affinity(QueryType queryType, ChunkType chunkType) {
        if (chunkType == null) {
            return 1.0;
        }
        return affinities.getOrDefault(queryType, Collections.emptyMap()).getOrDefault(chunkType, 1.0);
    }

    public double getVariableOverlapBonus() {
        return variableOverlapBonus;
    }

    public Map<QueryType, Map<ChunkType, Double>> getAffinities() {
        return affinities;
    }

    public static final class Builder {

        private final Map<QueryType, Map<ChunkType, Double>> affinities = new EnumMap<>(QueryType.class);
        private double variableOverlapBonus = DEFAULT_VARIABLE_OVERLAP_BONUS;

        private Builder() {
        }

        public Builder affinity(QueryType queryType, ChunkType chunkType, double multiplier) {
            if (multiplier <= 0 || Double.isNaN(multiplier)) {
                throw new IllegalArgumentException("Affinity multiplier must be positive: " + multiplier);
            }
            affinities.computeIfAbsent(queryType, type -> new EnumMap<>(ChunkType.class)).put(chunkType, multiplier);
            return this;
        }

        public Builder variableOverlapBonus(double bonus) {
            if (bonus <= 0 || Double.isNaN(bonus)) {
                throw new IllegalArgumentException("Variable overlap bonus must be positive: " + bonus);
            }
            this.variableOverlapBonus = bonus;
            return this;
        }

        public RerankingPolicy build() {
            Map<QueryType, Map<ChunkType, Double>> copy = new EnumMap<>(QueryType.class);
            affinities.forEach((type, byChunk) ->
                    copy.put(type, Collections.unmodifiableMap(new EnumMap<>(byChunk))));
            return new RerankingPolicy(Collections.unmodifiableMap(copy), variableOverlapBonus);
        }
    }
}

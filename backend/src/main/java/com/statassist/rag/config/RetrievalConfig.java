package com.statassist.rag.config;

import com.statassist.rag.model.ChunkType;
import com.statassist.rag.model.QueryType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Binds the {@code rag.*} retrieval properties.
 */
@Configuration
@Slf4j
public class RetrievalConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetrievalSettings retrievalSettings(
            @Value("${rag.default-top-k:5}") int defaultTopK,
            @Value("${rag.max-top-k:20}") int maxTopK,
            @Value("${rag.row-chunk-size:100}") int rowChunkSize,
            @Value("${rag.ingest-timeout-ms:300000}") long ingestTimeoutMs,
            @Value("${rag.query-timeout-ms:30000}") long queryTimeoutMs) {
        if (defaultTopK <= 0 || maxTopK <= 0 || rowChunkSize <= 0) {
            throw new IllegalStateException("rag.default-top-k, rag.max-top-k and rag.row-chunk-size must be positive");
        }
        RetrievalSettings settings = RetrievalSettings.builder()
                .defaultTopK(defaultTopK)
                .maxTopK(maxTopK)
                .rowChunkSize(rowChunkSize)
                .ingestTimeout(Duration.ofMillis(ingestTimeoutMs))
                .queryTimeout(Duration.ofMillis(queryTimeoutMs))
                .build();
        log.info("Retrieval settings: {}", settings);
        return settings;
    }

    @Bean
    public RerankingPolicy rerankingPolicy(
            @Value("${rag.reranking.descriptive.statistical-summary:1.5}") double descriptiveSummary,
            @Value("${rag.reranking.descriptive.column-group:1.2}") double descriptiveColumns,
            @Value("${rag.reranking.correlation.correlation-matrix:1.8}") double correlationMatrix,
            @Value("${rag.reranking.correlation.statistical-summary:1.3}") double correlationSummary,
            @Value("${rag.reranking.visualization.column-group:1.4}") double visualizationColumns,
            @Value("${rag.reranking.visualization.correlation-matrix:1.3}") double visualizationMatrix,
            @Value("${rag.reranking.variable-overlap-bonus:1.3}") double variableBonus) {
        return RerankingPolicy.builder()
                .affinity(QueryType.DESCRIPTIVE, ChunkType.STATISTICAL_SUMMARY, descriptiveSummary)
                .affinity(QueryType.DESCRIPTIVE, ChunkType.COLUMN_GROUP, descriptiveColumns)
                .affinity(QueryType.CORRELATION, ChunkType.CORRELATION_MATRIX, correlationMatrix)
                .affinity(QueryType.CORRELATION, ChunkType.STATISTICAL_SUMMARY, correlationSummary)
                .affinity(QueryType.VISUALIZATION, ChunkType.COLUMN_GROUP, visualizationColumns)
                .affinity(QueryType.VISUALIZATION, ChunkType.CORRELATION_MATRIX, visualizationMatrix)
                .variableOverlapBonus(variableBonus)
                .build();
    }
}

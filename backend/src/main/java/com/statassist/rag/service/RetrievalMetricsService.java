package com.statassist.rag.service;

import com.statassist.rag.controller.MonitoringController;
import com.statassist.rag.embedding.EmbeddingProvider;
import com.statassist.rag.embedding.RemoteEmbeddingClient;
import com.statassist.rag.embedding.SerializedEmbeddingProvider;
import com.statassist.rag.model.QueryType;
import com.statassist.rag.store.VectorIndexStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory retrieval metrics: query and ingest outcomes, per-stage latencies and the
 * distribution of classified query types. Keeps the most recent {@value #MAX_SAMPLES}
 * samples of each kind.
 */
@Service
@Slf4j
public class RetrievalMetricsService {

    static final int MAX_SAMPLES = 1000;
    static final String UNKNOWN_TYPE = "unknown";

    private final Deque<QueryMetric> queryMetrics = new ConcurrentLinkedDeque<>();
    private final Deque<IngestMetric> ingestMetrics = new ConcurrentLinkedDeque<>();
    private final Deque<StageMetric> stageMetrics = new ConcurrentLinkedDeque<>();

    private final AtomicLong totalQueries = new AtomicLong(0);
    private final AtomicLong failedQueries = new AtomicLong(0);
    private final AtomicLong totalIngests = new AtomicLong(0);
    private final AtomicLong failedIngests = new AtomicLong(0);

    private final Clock clock;
    private final EmbeddingProvider embeddingProvider;
    private final VectorIndexStore store;

    public RetrievalMetricsService(Clock clock, EmbeddingProvider embeddingProvider, VectorIndexStore store) {
        this.clock = clock;
        this.embeddingProvider = embeddingProvider;
        this.store = store;
    }

    public void recordQuery(String sessionId, QueryType type, double confidence,
                            int resultCount, long latencyMs, boolean success) {
        append(queryMetrics, new QueryMetric(sessionId, type == null ? UNKNOWN_TYPE : type.getLabel(),
                confidence, resultCount, latencyMs, success, clock.instant()));
        totalQueries.incrementAndGet();
        if (!success) {
            failedQueries.incrementAndGet();
        }
    }

    public void recordIngest(String sessionId, int chunkCount, long latencyMs, boolean success) {
        append(ingestMetrics, new IngestMetric(sessionId, chunkCount, latencyMs, success, clock.instant()));
        totalIngests.incrementAndGet();
        if (!success) {
            failedIngests.incrementAndGet();
        }
    }

    /**
     * Per-stage latencies of one query, e.g. classification, embedding, vector_search.
     */
    public void recordStages(Map<String, Long> stageLatencies) {
        append(stageMetrics, new StageMetric(new LinkedHashMap<>(stageLatencies), clock.instant()));
    }

    public MonitoringController.QueryAnalytics getQueryAnalytics(int lookbackHours) {
        List<QueryMetric> recent = recent(queryMetrics, lookbackHours, QueryMetric::getTimestamp);

        MonitoringController.QueryAnalytics analytics = new MonitoringController.QueryAnalytics();
        analytics.setTotalQueries(recent.size());
        if (recent.isEmpty()) {
            analytics.setQueriesByType(Collections.emptyMap());
            analytics.setAverageLatencyByType(Collections.emptyMap());
            analytics.setAverageConfidenceByType(Collections.emptyMap());
            return analytics;
        }

        List<Long> latencies = recent.stream()
                .map(QueryMetric::getLatencyMs)
                .sorted()
                .collect(Collectors.toList());
        analytics.setAverageLatencyMs(latencies.stream().mapToLong(Long::longValue).average().orElse(0.0));
        analytics.setP50LatencyMs(percentile(latencies, 0.50));
        analytics.setP95LatencyMs(percentile(latencies, 0.95));
        analytics.setP99LatencyMs(percentile(latencies, 0.99));

        Map<String, List<QueryMetric>> byType = recent.stream()
                .collect(Collectors.groupingBy(QueryMetric::getQueryType));
        Map<String, Long> counts = new HashMap<>();
        Map<String, Double> latencyByType = new HashMap<>();
        Map<String, Double> confidenceByType = new HashMap<>();
        byType.forEach((type, metrics) -> {
            counts.put(type, (long) metrics.size());
            latencyByType.put(type, metrics.stream().mapToLong(QueryMetric::getLatencyMs).average().orElse(0.0));
            confidenceByType.put(type, metrics.stream().mapToDouble(QueryMetric::getConfidence).average().orElse(0.0));
        });
        analytics.setQueriesByType(counts);
        analytics.setAverageLatencyByType(latencyByType);
        analytics.setAverageConfidenceByType(confidenceByType);

        long successful = recent.stream().filter(QueryMetric::isSuccess).count();
        analytics.setSuccessfulQueries(successful);
        analytics.setFailedQueries(recent.size() - successful);
        analytics.setSuccessRate((double) successful / recent.size());
        analytics.setEmptyResultQueries(recent.stream()
                .filter(QueryMetric::isSuccess)
                .filter(metric -> metric.getResultCount() == 0)
                .count());
        return analytics;
    }

    public MonitoringController.IngestAnalytics getIngestAnalytics(int lookbackHours) {
        List<IngestMetric> recent = recent(ingestMetrics, lookbackHours, IngestMetric::getTimestamp);

        MonitoringController.IngestAnalytics analytics = new MonitoringController.IngestAnalytics();
        analytics.setTotalIngests(recent.size());
        if (recent.isEmpty()) {
            return analytics;
        }
        long successful = recent.stream().filter(IngestMetric::isSuccess).count();
        analytics.setSuccessfulIngests(successful);
        analytics.setFailedIngests(recent.size() - successful);
        analytics.setAverageLatencyMs(recent.stream().mapToLong(IngestMetric::getLatencyMs).average().orElse(0.0));
        analytics.setAverageChunkCount(recent.stream()
                .filter(IngestMetric::isSuccess)
                .mapToInt(IngestMetric::getChunkCount)
                .average()
                .orElse(0.0));
        return analytics;
    }

    public MonitoringController.PerformanceMetrics getPerformanceMetrics(int lookbackHours) {
        List<StageMetric> recent = recent(stageMetrics, lookbackHours, StageMetric::getTimestamp);

        MonitoringController.PerformanceMetrics metrics = new MonitoringController.PerformanceMetrics();
        metrics.setTotalRequests(recent.size());
        if (recent.isEmpty()) {
            metrics.setStageLatencies(Collections.emptyMap());
            return metrics;
        }

        Map<String, List<Long>> byStage = new HashMap<>();
        for (StageMetric metric : recent) {
            metric.getStageLatencies().forEach((stage, latency) ->
                    byStage.computeIfAbsent(stage, key -> new ArrayList<>()).add(latency));
        }
        Map<String, Double> averages = byStage.entrySet().stream()
                .collect(Collectors.toMap(
                        Map.Entry::getKey,
                        e -> e.getValue().stream().mapToLong(Long::longValue).average().orElse(0.0)));

        metrics.setStageLatencies(averages);
        metrics.setClassificationAvgMs(averages.getOrDefault("classification", 0.0));
        metrics.setEmbeddingAvgMs(averages.getOrDefault("embedding", 0.0));
        metrics.setVectorSearchAvgMs(averages.getOrDefault("vector_search", 0.0));
        metrics.setRerankingAvgMs(averages.getOrDefault("reranking", 0.0));
        metrics.setTotalPipelineAvgMs(averages.getOrDefault("total", 0.0));
        return metrics;
    }

    public MonitoringController.HealthSummary getHealthSummary() {
        MonitoringController.HealthSummary summary = new MonitoringController.HealthSummary();

        Map<String, String> componentStatus = new LinkedHashMap<>();
        componentStatus.put("backend", "UP");
        componentStatus.put("vector_store", "UP");
        componentStatus.put("embedding_provider", embeddingStatus());

        summary.setComponentStatus(componentStatus);
        summary.setOverallStatus(componentStatus.containsValue("DOWN") ? "DEGRADED" : "UP");
        summary.setLastCheck(LocalDateTime.now(clock));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("embedding_provider", embeddingProvider.describe());
        metrics.put("active_collections", store.listCollections().size());
        metrics.put("total_queries", totalQueries.get());
        metrics.put("failed_queries", failedQueries.get());
        metrics.put("total_ingests", totalIngests.get());
        metrics.put("failed_ingests", failedIngests.get());
        metrics.put("query_success_rate", totalQueries.get() > 0
                ? (double) (totalQueries.get() - failedQueries.get()) / totalQueries.get() : 0.0);
        summary.setMetrics(metrics);
        return summary;
    }

    private String embeddingStatus() {
        EmbeddingProvider provider = embeddingProvider;
        if (provider instanceof SerializedEmbeddingProvider) {
            provider = ((SerializedEmbeddingProvider) provider).getDelegate();
        }
        if (provider instanceof RemoteEmbeddingClient) {
            return ((RemoteEmbeddingClient) provider).checkHealth() ? "UP" : "DOWN";
        }
        return "UP";
    }

    // Helper methods

    private <T> void append(Deque<T> samples, T sample) {
        samples.addLast(sample);
        while (samples.size() > MAX_SAMPLES) {
            samples.pollFirst();
        }
    }

    private <T> List<T> recent(Deque<T> samples, int lookbackHours, Function<T, Instant> timestamp) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(lookbackHours));
        Predicate<T> inWindow = sample -> !timestamp.apply(sample).isBefore(cutoff);
        return samples.stream().filter(inWindow).collect(Collectors.toList());
    }

    private double percentile(List<Long> sortedValues, double percentile) {
        if (sortedValues.isEmpty()) return 0.0;
        int index = (int) Math.ceil(percentile * sortedValues.size()) - 1;
        index = Math.max(0, Math.min(index, sortedValues.size() - 1));
        return sortedValues.get(index);
    }

    // Data classes

    private static class QueryMetric {
        private final String sessionId;
        private final String queryType;
        private final double confidence;
        private final int resultCount;
        private final long latencyMs;
        private final boolean success;
        private final Instant timestamp;

        QueryMetric(String sessionId, String queryType, double confidence, int resultCount,
                    long latencyMs, boolean success, Instant timestamp) {
            this.sessionId = sessionId;
            this.queryType = queryType;
            this.confidence = confidence;
            this.resultCount = resultCount;
            this.latencyMs = latencyMs;
            this.success = success;
            this.timestamp = timestamp;
        }

        public String getSessionId() { return sessionId; }
        public String getQueryType() { return queryType; }
        public double getConfidence() { return confidence; }
        public int getResultCount() { return resultCount; }
        public long getLatencyMs() { return latencyMs; }
        public boolean isSuccess() { return success; }
        public Instant getTimestamp() { return timestamp; }
    }

    private static class IngestMetric {
        private final String sessionId;
        private final int chunkCount;
        private final long latencyMs;
        private final boolean success;
        private final Instant timestamp;

        IngestMetric(String sessionId, int chunkCount, long latencyMs, boolean success, Instant timestamp) {
            this.sessionId = sessionId;
            this.chunkCount = chunkCount;
            this.latencyMs = latencyMs;
            this.success = success;
            this.timestamp = timestamp;
        }

        public String getSessionId() { return sessionId; }
        public int getChunkCount() { return chunkCount; }
        public long getLatencyMs() { return latencyMs; }
        public boolean isSuccess() { return success; }
        public Instant getTimestamp() { return timestamp; }
    }

    private static class StageMetric {
        private final Map<String, Long> stageLatencies;
        private final Instant timestamp;

        StageMetric(Map<String, Long> stageLatencies, Instant timestamp) {
            this.stageLatencies = stageLatencies;
            this.timestamp = timestamp;
        }

        public Map<String, Long> getStageLatencies() { return stageLatencies; }
        public Instant getTimestamp() { return timestamp; }
    }
}

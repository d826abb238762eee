package com.statassist.rag.controller;

import com.statassist.rag.service.RetrievalMetricsService;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Monitoring endpoints for the retrieval pipeline:
 * - query analytics (latency percentiles, query-type distribution)
 * - ingest analytics
 * - per-stage latencies
 * - component health
 */
@RestController
@RequestMapping("/monitoring")
@CrossOrigin(origins = "*")
@Slf4j
public class MonitoringController {

    private static final int DEFAULT_LOOKBACK_HOURS = 24;

    private final RetrievalMetricsService metricsService;

    public MonitoringController(RetrievalMetricsService metricsService) {
        this.metricsService = metricsService;
    }

    @GetMapping("/analytics/queries")
    public ResponseEntity<QueryAnalytics> getQueryAnalytics(@RequestParam(required = false) Integer hours) {
        return ResponseEntity.ok(metricsService.getQueryAnalytics(lookback(hours)));
    }

    @GetMapping("/analytics/ingests")
    public ResponseEntity<IngestAnalytics> getIngestAnalytics(@RequestParam(required = false) Integer hours) {
        return ResponseEntity.ok(metricsService.getIngestAnalytics(lookback(hours)));
    }

    /**
     * Average latency per query stage: classification, augmentation, embedding,
     * vector_search, reranking, total.
     */
    @GetMapping("/metrics/performance")
    public ResponseEntity<PerformanceMetrics> getPerformanceMetrics(@RequestParam(required = false) Integer hours) {
        return ResponseEntity.ok(metricsService.getPerformanceMetrics(lookback(hours)));
    }

    @GetMapping("/health/summary")
    public ResponseEntity<HealthSummary> getHealthSummary() {
        return ResponseEntity.ok(metricsService.getHealthSummary());
    }

    private static int lookback(Integer hours) {
        return hours != null && hours > 0 ? hours : DEFAULT_LOOKBACK_HOURS;
    }

    // Data classes

    @Data
    public static class QueryAnalytics {
        private long totalQueries;
        private double averageLatencyMs;
        private double p50LatencyMs;
        private double p95LatencyMs;
        private double p99LatencyMs;
        private Map<String, Long> queriesByType;
        private Map<String, Double> averageLatencyByType;
        private Map<String, Double> averageConfidenceByType;
        private long successfulQueries;
        private long failedQueries;
        private long emptyResultQueries;
        private double successRate;
    }

    @Data
    public static class IngestAnalytics {
        private long totalIngests;
        private long successfulIngests;
        private long failedIngests;
        private double averageLatencyMs;
        private double averageChunkCount;
    }

    @Data
    public static class PerformanceMetrics {
        private double classificationAvgMs;
        private double embeddingAvgMs;
        private double vectorSearchAvgMs;
        private double rerankingAvgMs;
        private double totalPipelineAvgMs;
        private Map<String, Double> stageLatencies;
        private long totalRequests;
    }

    @Data
    public static class HealthSummary {
        private String overallStatus;
        private Map<String, String> componentStatus;
        private LocalDateTime lastCheck;
        private Map<String, Object> metrics;
    }
}

package com.statassist.rag.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.statassist.rag.chunking.DatasetChunker;
import com.statassist.rag.config.RetrievalSettings;
import com.statassist.rag.dataset.Dataset;
import com.statassist.rag.embedding.EmbeddingProvider;
import com.statassist.rag.exception.CollectionNotFoundException;
import com.statassist.rag.exception.EmbeddingException;
import com.statassist.rag.exception.IngestionException;
import com.statassist.rag.exception.InvalidRequestException;
import com.statassist.rag.exception.OperationTimeoutException;
import com.statassist.rag.intent.QueryIntentClassifier;
import com.statassist.rag.model.ChunkType;
import com.statassist.rag.model.CollectionInfo;
import com.statassist.rag.model.ContextValue;
import com.statassist.rag.model.DataChunk;
import com.statassist.rag.model.QueryIntent;
import com.statassist.rag.model.RankedChunk;
import com.statassist.rag.model.RetrievalResult;
import com.statassist.rag.model.RetrievedChunk;
import com.statassist.rag.model.ScoredRetrieval;
import com.statassist.rag.store.CollectionHandle;
import com.statassist.rag.store.IndexCandidate;
import com.statassist.rag.store.IndexRecord;
import com.statassist.rag.store.VectorIndexStore;
import dev.langchain4j.store.embedding.filter.Filter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * Owns the per-session index lifecycle and the query pipeline.
 * <p>
 * Ingest: Dataset → chunks → embeddings → one collection named {@code session_<id>}.
 * Query: text → intent → augmented text → embedding → top-k search → intent re-ranking.
 * <p>
 * Per session: {@code Absent → ingest → Active → ingest → Active (replaced) → delete → Absent}.
 * Ingest and delete of the same session are serialised; queries run concurrently.
 */
@Service
@Slf4j
public class RetrievalOrchestrator {

    static final String COLLECTION_PREFIX = "session_";
    static final String CHUNK_TYPE_KEY = "chunk_type";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() {};

    private final QueryIntentClassifier classifier;
    private final DatasetChunker chunker;
    private final EmbeddingProvider embeddingProvider;
    private final VectorIndexStore store;
    private final QueryAugmentationService augmentationService;
    private final ResultReranker reranker;
    private final RetrievalMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final RetrievalSettings settings;
    private final Clock clock;

    /** Sessions hash onto a fixed set of locks; ingest and delete of one session never interleave. */
    static final int SESSION_LOCK_STRIPES = 64;

    private final ReentrantLock[] sessionLocks = new ReentrantLock[SESSION_LOCK_STRIPES];

    public RetrievalOrchestrator(QueryIntentClassifier classifier,
                                 DatasetChunker chunker,
                                 EmbeddingProvider embeddingProvider,
                                 VectorIndexStore store,
                                 QueryAugmentationService augmentationService,
                                 ResultReranker reranker,
                                 RetrievalMetricsService metricsService,
                                 ObjectMapper objectMapper,
                                 RetrievalSettings settings,
                                 Clock clock) {
        this.classifier = classifier;
        this.chunker = chunker;
        this.embeddingProvider = embeddingProvider;
        this.store = store;
        this.augmentationService = augmentationService;
        this.reranker = reranker;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.clock = clock;
        for (int i = 0; i < sessionLocks.length; i++) {
            sessionLocks[i] = new ReentrantLock();
        }
    }

    public static String collectionName(String sessionId) {
        return COLLECTION_PREFIX + sessionId;
    }

    // ------------------------------------------------------------------ ingest

    public CollectionHandle ingest(String sessionId, Dataset dataset) {
        return ingest(sessionId, dataset, null, settings.getIngestTimeout());
    }

    public CollectionHandle ingest(String sessionId, Dataset dataset, String filename) {
        return ingest(sessionId, dataset, filename, settings.getIngestTimeout());
    }

    /**
     * Replaces the session's collection with a fresh index of {@code dataset}.
     * <p>
     * Chunks whose embedding fails are skipped. On any other failure, or when the deadline
     * passes, no collection is left for the session.
     *
     * @throws IngestionException        when no chunk could be produced or embedded, or the store rejects the collection
     * @throws OperationTimeoutException when {@code timeout} elapses
     */
    public CollectionHandle ingest(String sessionId, Dataset dataset, String filename, Duration timeout) {
        requireSessionId(sessionId);
        if (dataset == null) {
            throw new InvalidRequestException("Dataset is required");
        }

        String name = collectionName(sessionId);
        Deadline deadline = Deadline.start("Ingest for session " + sessionId, timeout, clock);
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("🔵 [INGEST-{}] Dataset '{}' ({} rows x {} columns) - STARTED",
                    sessionId, dataset.name(), dataset.rowCount(), dataset.columnCount());

            if (store.deleteCollection(name)) {
                log.info("   Replaced existing collection {}", name);
            }

            long chunkStart = clock.millis();
            List<DataChunk> chunks = chunker.chunk(dataset, settings.getRowChunkSize());
            if (chunks.isEmpty()) {
                throw new IngestionException("Chunker produced no chunks for dataset '" + dataset.name() + "'");
            }
            log.info("✅ [INGEST-{}] Chunking - COMPLETED (Duration: {}ms, {} chunks)",
                    sessionId, clock.millis() - chunkStart, chunks.size());
            deadline.check();

            long embedStart = clock.millis();
            List<IndexRecord> records = embedChunks(sessionId, chunks, deadline);
            if (records.isEmpty()) {
                throw new IngestionException("None of the " + chunks.size()
                        + " chunks could be embedded for session " + sessionId);
            }
            log.info("✅ [INGEST-{}] Embedding - COMPLETED (Duration: {}ms, {}/{} chunks)",
                    sessionId, clock.millis() - embedStart, records.size(), chunks.size());

            deadline.check();
            CollectionHandle handle;
            try {
                handle = store.createCollection(name, collectionMetadata(sessionId, dataset, filename), records);
            } catch (RuntimeException e) {
                throw new IngestionException("Vector store rejected collection " + name + ": " + e.getMessage(), e);
            }
            try {
                deadline.check();
            } catch (OperationTimeoutException e) {
                discard(name);
                throw e;
            }

            long elapsed = deadline.elapsedMs();
            metricsService.recordIngest(sessionId, records.size(), elapsed, true);
            log.info("✅ [INGEST-{}] Collection {} ready with {} chunks (Duration: {}ms)",
                    sessionId, name, records.size(), elapsed);
            log.info("═══════════════════════════════════════════════════════════════");
            return handle;

        } catch (RuntimeException e) {
            metricsService.recordIngest(sessionId, 0, deadline.elapsedMs(), false);
            log.error("❌ [INGEST-{}] FAILED: {}", sessionId, e.getMessage());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private List<IndexRecord> embedChunks(String sessionId, List<DataChunk> chunks, Deadline deadline) {
        List<IndexRecord> records = new ArrayList<>(chunks.size());
        for (DataChunk chunk : chunks) {
            deadline.check();
            try {
                float[] vector = embeddingProvider.embed(chunk.getContent());
                records.add(new IndexRecord(chunk.getId(), vector, chunk.getContent(), recordMetadata(chunk)));
            } catch (RuntimeException e) {
                log.warn("⚠️  [INGEST-{}] Skipping {} chunk {}: {}",
                        sessionId, chunk.getChunkType().getLabel(), chunk.getId(), e.getMessage());
            }
        }
        return records;
    }

    /**
     * Flat string metadata as stored alongside each vector; nested values are JSON text.
     */
    Map<String, String> recordMetadata(DataChunk chunk) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("chunk_id", chunk.getId());
        metadata.put(CHUNK_TYPE_KEY, chunk.getChunkType().getLabel());
        metadata.put("variables", toJson(chunk.getVariables()));
        metadata.put("data_types", toJson(chunk.getDataTypes()));
        metadata.put("statistical_context", toJson(chunk.getStatisticalContext()));
        metadata.put("metadata", toJson(chunk.getMetadata()));
        return metadata;
    }

    private Map<String, ContextValue> collectionMetadata(String sessionId, Dataset dataset, String filename) {
        Map<String, ContextValue> metadata = new LinkedHashMap<>();
        metadata.put("session_id", ContextValue.of(sessionId));
        metadata.put("filename", ContextValue.of(filename != null ? filename : dataset.name()));
        metadata.put("created_at", ContextValue.of(clock.instant().toString()));
        metadata.put("row_count", ContextValue.of(dataset.rowCount()));
        metadata.put("column_count", ContextValue.of(dataset.columnCount()));
        return metadata;
    }

    private void discard(String name) {
        try {
            store.deleteCollection(name);
            log.warn("⚠️  Discarded partially populated collection {}", name);
        } catch (RuntimeException e) {
            log.error("❌ Could not discard collection {}: {}", name, e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------- query

    public RetrievalResult query(String sessionId, String queryText) {
        return query(sessionId, queryText, null);
    }

    /**
     * Ranked chunk texts, best first, with the classified intent.
     *
     * @param topK number of neighbours to fetch; null selects {@code rag.default-top-k}, larger values are capped
     * @throws CollectionNotFoundException when the session has no collection
     * @throws EmbeddingException          when the query text cannot be embedded
     */
    public RetrievalResult query(String sessionId, String queryText, Integer topK) {
        return queryScored(sessionId, queryText, topK, null, settings.getQueryTimeout()).toResult();
    }

    public RetrievalResult query(String sessionId, String queryText, Integer topK, Set<ChunkType> chunkTypes) {
        return queryScored(sessionId, queryText, topK, chunkTypes, settings.getQueryTimeout()).toResult();
    }

    /**
     * Same pipeline as {@link #query(String, String, Integer)}, keeping the augmented query
     * and each candidate's scoring factors. Bounded by {@code rag.query-timeout-ms}.
     *
     * @param chunkTypes restricts candidates to these chunk types; null or empty for all
     */
    public ScoredRetrieval queryScored(String sessionId, String queryText, Integer topK, Set<ChunkType> chunkTypes) {
        return queryScored(sessionId, queryText, topK, chunkTypes, settings.getQueryTimeout());
    }

    /**
     * @param timeout overall budget; null runs without a deadline
     */
    public ScoredRetrieval queryScored(String sessionId, String queryText, Integer topK,
                                       Set<ChunkType> chunkTypes, Duration timeout) {
        requireSessionId(sessionId);
        if (queryText == null || queryText.isBlank()) {
            throw new InvalidRequestException("Query text is required");
        }

        Deadline deadline = Deadline.start("Query for session " + sessionId, timeout, clock);
        Map<String, Long> stages = new LinkedHashMap<>();
        QueryIntent intent = null;
        try {
            CollectionHandle handle = store.getCollection(collectionName(sessionId))
                    .orElseThrow(() -> new CollectionNotFoundException(sessionId));

            long stageStart = clock.millis();
            intent = classifier.classify(queryText);
            stages.put("classification", clock.millis() - stageStart);
            log.info("🔵 [QUERY-{}] '{}' classified as {} (confidence {})", sessionId, queryText,
                    intent.getType().getLabel(), String.format("%.2f", intent.getConfidence()));

            stageStart = clock.millis();
            String augmented = augmentationService.augment(queryText, intent);
            stages.put("augmentation", clock.millis() - stageStart);
            deadline.check();

            stageStart = clock.millis();
            float[] vector = embedQuery(augmented);
            stages.put("embedding", clock.millis() - stageStart);
            deadline.check();

            stageStart = clock.millis();
            int k = settings.resolveTopK(topK);
            List<IndexCandidate> candidates;
            try {
                candidates = store.query(handle, vector, k, chunkTypeFilter(chunkTypes));
            } catch (IllegalStateException e) {
                // collection deleted between lookup and search
                throw new CollectionNotFoundException(sessionId);
            }
            stages.put("vector_search", clock.millis() - stageStart);
            deadline.check();

            stageStart = clock.millis();
            List<RankedChunk> ranked = reranker.rerank(
                    candidates.stream().map(this::toRetrievedChunk).collect(Collectors.toList()), intent);
            stages.put("reranking", clock.millis() - stageStart);

            long total = deadline.elapsedMs();
            stages.put("total", total);
            metricsService.recordStages(stages);
            metricsService.recordQuery(sessionId, intent.getType(), intent.getConfidence(), ranked.size(), total, true);
            log.info("✅ [QUERY-{}] {} results (top-k {}) (Duration: {}ms)", sessionId, ranked.size(), k, total);

            return new ScoredRetrieval(augmented, intent, ranked);

        } catch (RuntimeException e) {
            metricsService.recordQuery(sessionId, intent == null ? null : intent.getType(),
                    intent == null ? 0.0 : intent.getConfidence(), 0, deadline.elapsedMs(), false);
            log.error("❌ [QUERY-{}] FAILED: {}", sessionId, e.getMessage());
            throw e;
        }
    }

    private float[] embedQuery(String augmented) {
        try {
            return embeddingProvider.embed(augmented);
        } catch (EmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingException("Failed to embed query: " + e.getMessage(), e);
        }
    }

    private static Filter chunkTypeFilter(Set<ChunkType> chunkTypes) {
        if (chunkTypes == null || chunkTypes.isEmpty()) {
            return null;
        }
        return metadataKey(CHUNK_TYPE_KEY).isIn(chunkTypes.stream()
                .map(ChunkType::getLabel)
                .collect(Collectors.toList()));
    }

    RetrievedChunk toRetrievedChunk(IndexCandidate candidate) {
        Map<String, String> metadata = candidate.getMetadata();
        List<String> variables;
        try {
            String json = metadata.get("variables");
            variables = json == null ? List.of() : objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable variables on chunk {}: {}", candidate.getId(), e.getMessage());
            variables = List.of();
        }
        return new RetrievedChunk(
                candidate.getId(),
                candidate.getDocument(),
                ChunkType.fromLabel(metadata.get(CHUNK_TYPE_KEY)),
                variables,
                candidate.getDistance());
    }

    // ----------------------------------------------------------- delete / info

    /**
     * Removes the session's collection.
     *
     * @return true when a collection was removed; false when none existed or removal failed
     */
    public boolean delete(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return false;
        }
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            boolean removed = store.deleteCollection(collectionName(sessionId));
            if (removed) {
                log.info("Deleted collection for session {}", sessionId);
            } else {
                log.debug("No collection to delete for session {}", sessionId);
            }
            return removed;
        } catch (RuntimeException e) {
            log.error("Error deleting collection for session {}: {}", sessionId, e.getMessage(), e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creation metadata and chunk count, or empty when the session has no collection.
     */
    public Optional<CollectionInfo> info(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        return store.getCollection(collectionName(sessionId)).flatMap(this::describe);
    }

    public List<CollectionInfo> listCollections() {
        return store.listCollections().stream()
                .map(this::describe)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    private Optional<CollectionInfo> describe(CollectionHandle handle) {
        try {
            return Optional.of(new CollectionInfo(handle.getName(), store.count(handle), handle.getMetadata()));
        } catch (IllegalStateException e) {
            log.debug("Collection {} vanished while describing it", handle.getName());
            return Optional.empty();
        }
    }

    // ----------------------------------------------------------------- helpers

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise chunk metadata: " + e.getMessage(), e);
        }
    }

    ReentrantLock lockFor(String sessionId) {
        return sessionLocks[Math.floorMod(sessionId.hashCode(), sessionLocks.length)];
    }

    private static void requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new InvalidRequestException("Session id is required");
        }
    }
}

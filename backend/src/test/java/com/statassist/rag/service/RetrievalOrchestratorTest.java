package com.statassist.rag.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.statassist.rag.chunking.DatasetChunker;
import com.statassist.rag.config.QueryAugmentationConfigLoader;
import com.statassist.rag.config.RerankingPolicy;
import com.statassist.rag.config.RetrievalSettings;
import com.statassist.rag.dataset.Dataset;
import com.statassist.rag.exception.CollectionNotFoundException;
import com.statassist.rag.exception.EmbeddingException;
import com.statassist.rag.exception.IngestionException;
import com.statassist.rag.exception.OperationTimeoutException;
import com.statassist.rag.intent.QueryIntentClassifier;
import com.statassist.rag.model.ChunkType;
import com.statassist.rag.model.ContextValue;
import com.statassist.rag.model.CollectionInfo;
import com.statassist.rag.model.QueryType;
import com.statassist.rag.model.RankedChunk;
import com.statassist.rag.model.RetrievalResult;
import com.statassist.rag.model.ScoredRetrieval;
import com.statassist.rag.store.CollectionHandle;
import com.statassist.rag.store.InMemoryVectorIndexStore;
import com.statassist.rag.store.IndexCandidate;
import com.statassist.rag.store.IndexRecord;
import com.statassist.rag.store.VectorIndexStore;
import com.statassist.rag.support.HashingEmbeddingProvider;
import com.statassist.rag.support.MutableClock;
import com.statassist.rag.support.TestDatasets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetrievalOrchestratorTest {

    private static final String CORRELATION_QUESTION = "What is the correlation between age and cholesterol?";

    private MutableClock clock;
    private HashingEmbeddingProvider embeddings;
    private InMemoryVectorIndexStore store;
    private RetrievalMetricsService metrics;
    private RetrievalOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        embeddings = new HashingEmbeddingProvider();
        store = new InMemoryVectorIndexStore();
        orchestrator = orchestrator(store, RetrievalSettings.builder().build());
    }

    private RetrievalOrchestrator orchestrator(VectorIndexStore vectorStore, RetrievalSettings settings) {
        QueryAugmentationConfigLoader loader = new QueryAugmentationConfigLoader();
        loader.load();
        metrics = new RetrievalMetricsService(clock, embeddings, vectorStore);
        return new RetrievalOrchestrator(
                new QueryIntentClassifier(),
                new DatasetChunker(),
                embeddings,
                vectorStore,
                new QueryAugmentationService(loader),
                new ResultReranker(RerankingPolicy.defaults()),
                metrics,
                new ObjectMapper(),
                settings,
                clock);
    }

    @Nested
    class Ingest {

        @Test
        void indexesEveryChunk() {
            CollectionHandle handle = orchestrator.ingest("s1", TestDatasets.plainNumeric(250), "plain.csv");

            assertThat(handle.getName()).isEqualTo("session_s1");
            CollectionInfo info = orchestrator.info("s1").orElseThrow();
            assertThat(info.getCount()).isEqualTo(6);
            assertThat(info.getMetadata().get("session_id").asText()).isEqualTo("s1");
            assertThat(info.getMetadata().get("filename").asText()).isEqualTo("plain.csv");
            assertThat(info.getMetadata().get("created_at").asText()).isEqualTo("2024-05-01T10:00:00Z");
            assertThat(info.getMetadata().get("row_count").asNumber().intValue()).isEqualTo(250);
        }

        @Test
        void reingestReplacesPreviousChunks() {
            orchestrator.ingest("s1", TestDatasets.clinical(250));
            orchestrator.ingest("s1", TestDatasets.clinical(50));

            assertThat(orchestrator.info("s1").orElseThrow().getCount())
                    .isEqualTo(new DatasetChunker().chunk(TestDatasets.clinical(50)).size());

            CollectionHandle handle = store.getCollection("session_s1").orElseThrow();
            List<IndexCandidate> all = store.query(handle, embeddings.embed("data subset rows"), 100, null);
            assertThat(all).extracting(IndexCandidate::getDocument)
                    .noneMatch(document -> document.contains("rows 200 to 249"));
        }

        @Test
        void skipsChunksThatFailToEmbed() {
            embeddings.failWhen(text -> text.startsWith("Correlation Analysis:"));

            orchestrator.ingest("s1", TestDatasets.plainNumeric(250));

            assertThat(orchestrator.info("s1").orElseThrow().getCount()).isEqualTo(5);
        }

        @Test
        void failsWhenNothingCanBeEmbedded() {
            orchestrator.ingest("s1", TestDatasets.clinical(20));
            embeddings.failWhen(text -> true);

            assertThatThrownBy(() -> orchestrator.ingest("s1", TestDatasets.clinical(20)))
                    .isInstanceOf(IngestionException.class);
            assertThat(orchestrator.info("s1")).isEmpty();
            assertThat(metrics.getIngestAnalytics(1).getFailedIngests()).isEqualTo(1);
        }

        @Test
        void deadlineLeavesNoCollection() {
            embeddings.onEmbed(() -> clock.advance(Duration.ofSeconds(1)));

            assertThatThrownBy(() -> orchestrator.ingest("s1", TestDatasets.plainNumeric(250), null,
                    Duration.ofSeconds(3)))
                    .isInstanceOf(OperationTimeoutException.class)
                    .hasMessageContaining("s1");
            assertThat(orchestrator.info("s1")).isEmpty();
            assertThat(store.listCollections()).isEmpty();
        }

        @Test
        void storeRejectionBecomesIngestionFailure() {
            VectorIndexStore failing = mock(VectorIndexStore.class);
            when(failing.createCollection(anyString(), anyMap(), anyList()))
                    .thenThrow(new IllegalStateException("disk full"));
            RetrievalOrchestrator withFailingStore = orchestrator(failing, RetrievalSettings.builder().build());

            assertThatThrownBy(() -> withFailingStore.ingest("s1", TestDatasets.clinical(10)))
                    .isInstanceOf(IngestionException.class)
                    .hasMessageContaining("disk full");
        }

        @Test
        void collectionIsNotQueryableWhilePopulating() {
            AtomicReference<RetrievalOrchestrator> owner = new AtomicReference<>();
            AtomicReference<Throwable> seenMidway = new AtomicReference<>();
            InMemoryVectorIndexStore observing = new InMemoryVectorIndexStore() {
                @Override
                public CollectionHandle createCollection(String name, Map<String, ContextValue> metadata,
                                                         List<IndexRecord> records) {
                    List<IndexRecord> observed = new AbstractList<IndexRecord>() {
                        @Override
                        public IndexRecord get(int index) {
                            if (index == 1) {
                                seenMidway.set(catchThrowable(
                                        () -> owner.get().query("s1", CORRELATION_QUESTION)));
                            }
                            return records.get(index);
                        }

                        @Override
                        public int size() {
                            return records.size();
                        }
                    };
                    return super.createCollection(name, metadata, observed);
                }
            };
            RetrievalOrchestrator populating = orchestrator(observing, RetrievalSettings.builder().build());
            owner.set(populating);

            populating.ingest("s1", TestDatasets.clinical(120));

            assertThat(seenMidway.get()).isInstanceOf(CollectionNotFoundException.class);
            assertThat(populating.info("s1").orElseThrow().getCount())
                    .isEqualTo(new DatasetChunker().chunk(TestDatasets.clinical(120)).size());
        }

        @Test
        void timeoutAfterPublishDiscardsCollection() {
            InMemoryVectorIndexStore slow = new InMemoryVectorIndexStore() {
                @Override
                public CollectionHandle createCollection(String name, Map<String, ContextValue> metadata,
                                                         List<IndexRecord> records) {
                    CollectionHandle handle = super.createCollection(name, metadata, records);
                    clock.advance(Duration.ofSeconds(10));
                    return handle;
                }
            };
            RetrievalOrchestrator withSlowStore = orchestrator(slow, RetrievalSettings.builder().build());

            assertThatThrownBy(() -> withSlowStore.ingest("s1", TestDatasets.clinical(10), null,
                    Duration.ofSeconds(3)))
                    .isInstanceOf(OperationTimeoutException.class);
            assertThat(slow.listCollections()).isEmpty();
        }

        @Test
        void rejectsMissingArguments() {
            assertThatThrownBy(() -> orchestrator.ingest(" ", TestDatasets.clinical(5)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> orchestrator.ingest("s1", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Query {

        @Test
        void correlationQuestionRanksCorrelationChunkFirst() {
            orchestrator.ingest("s1", TestDatasets.clinical(120));

            ScoredRetrieval result = orchestrator.queryScored("s1", CORRELATION_QUESTION, 20, null, null);

            assertThat(result.getIntent().getType()).isEqualTo(QueryType.CORRELATION);
            assertThat(result.getAugmentedQuery()).contains("variables: age cholesterol");
            RankedChunk top = result.getRanked().get(0);
            assertThat(top.getChunkType()).isEqualTo(ChunkType.CORRELATION_MATRIX);
            assertThat(top.getAffinity()).isEqualTo(1.8);
            assertThat(top.getVariableBonus()).isEqualTo(1.3);
            assertThat(result.getRanked()).extracting(RankedChunk::getScore)
                    .isSortedAccordingTo((a, b) -> Double.compare(b, a));
        }

        @Test
        void returnsChunkTextsAndIntent() {
            orchestrator.ingest("s1", TestDatasets.clinical(120));

            RetrievalResult result = orchestrator.query("s1", CORRELATION_QUESTION);

            assertThat(result.getChunks()).hasSize(5);
            assertThat(result.getChunks().get(0)).startsWith("Correlation Analysis:");
            assertThat(result.getIntent().getVariables()).contains("age", "cholesterol");
        }

        @Test
        void topKIsCappedAndDefaulted() {
            orchestrator = orchestrator(store, RetrievalSettings.builder().defaultTopK(2).maxTopK(3).build());
            orchestrator.ingest("s1", TestDatasets.clinical(250));

            assertThat(orchestrator.query("s1", "describe the data").getChunks()).hasSize(2);
            assertThat(orchestrator.query("s1", "describe the data", 50).getChunks()).hasSize(3);
        }

        @Test
        void filtersByChunkType() {
            orchestrator.ingest("s1", TestDatasets.clinical(120));

            RetrievalResult result = orchestrator.query("s1", "show me the rows", 20,
                    EnumSet.of(ChunkType.ROW_GROUP));

            assertThat(result.getChunks()).hasSize(2)
                    .allSatisfy(chunk -> assertThat(chunk).startsWith("Data subset from rows"));
        }

        @Test
        void unknownSessionIsNotFound() {
            assertThatThrownBy(() -> orchestrator.query("nobody", "describe"))
                    .isInstanceOf(CollectionNotFoundException.class)
                    .hasMessage("No collection found for session nobody");
        }

        @Test
        void deletedSessionIsNotFound() {
            orchestrator.ingest("s1", TestDatasets.clinical(20));

            assertThat(orchestrator.delete("s1")).isTrue();
            assertThat(orchestrator.delete("s1")).isFalse();
            assertThatThrownBy(() -> orchestrator.query("s1", "describe"))
                    .isInstanceOf(CollectionNotFoundException.class);
        }

        @Test
        void queryEmbeddingFailureSurfaces() {
            orchestrator.ingest("s1", TestDatasets.clinical(20));
            embeddings.failWhen(text -> true);

            assertThatThrownBy(() -> orchestrator.query("s1", "describe"))
                    .isInstanceOf(EmbeddingException.class);
            assertThat(metrics.getQueryAnalytics(1).getFailedQueries()).isEqualTo(1);
        }

        @Test
        void scoredQueryDefaultsToConfiguredTimeout() {
            orchestrator = orchestrator(store, RetrievalSettings.builder().queryTimeout(Duration.ofSeconds(2)).build());
            orchestrator.ingest("s1", TestDatasets.clinical(20));
            embeddings.onEmbed(() -> clock.advance(Duration.ofSeconds(5)));

            assertThatThrownBy(() -> orchestrator.queryScored("s1", CORRELATION_QUESTION, null, null))
                    .isInstanceOf(OperationTimeoutException.class);
            assertThat(orchestrator.queryScored("s1", CORRELATION_QUESTION, null, null, null).getRanked())
                    .isNotEmpty();
        }

        @Test
        void rejectsBlankQuestion() {
            assertThatThrownBy(() -> orchestrator.query("s1", "  "))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void recordsStageLatencies() {
            orchestrator.ingest("s1", TestDatasets.clinical(20));
            orchestrator.query("s1", CORRELATION_QUESTION);

            assertThat(metrics.getPerformanceMetrics(1).getStageLatencies())
                    .containsKeys("classification", "augmentation", "embedding", "vector_search", "reranking", "total");
            assertThat(metrics.getQueryAnalytics(1).getQueriesByType()).containsEntry("correlation", 1L);
        }
    }

    @Nested
    class Sessions {

        @Test
        void sessionsAreIsolated() {
            orchestrator.ingest("a", TestDatasets.clinical(20));
            orchestrator.ingest("b", TestDatasets.plainNumeric(20));

            orchestrator.delete("a");

            assertThat(orchestrator.info("a")).isEmpty();
            assertThat(orchestrator.query("b", "describe the price").getChunks()).isNotEmpty();
            assertThat(orchestrator.listCollections()).extracting(CollectionInfo::getName)
                    .containsExactly("session_b");
        }

        @Test
        void deleteNeverThrows() {
            VectorIndexStore failing = mock(VectorIndexStore.class);
            when(failing.deleteCollection(any())).thenThrow(new IllegalStateException("unreachable"));
            RetrievalOrchestrator withFailingStore = orchestrator(failing, RetrievalSettings.builder().build());

            assertThat(withFailingStore.delete("s1")).isFalse();
            assertThat(withFailingStore.delete("")).isFalse();
            assertThat(withFailingStore.info(null)).isEqualTo(Optional.empty());
        }

        @Test
        void deletingUnknownSessionsReusesFixedLocks() {
            ReentrantLock first = orchestrator.lockFor("never-ingested-0");
            Set<ReentrantLock> distinct = Collections.newSetFromMap(new IdentityHashMap<>());

            for (int i = 0; i < 10_000; i++) {
                String sessionId = "never-ingested-" + i;
                assertThat(orchestrator.delete(sessionId)).isFalse();
                distinct.add(orchestrator.lockFor(sessionId));
            }

            assertThat(distinct).hasSizeLessThanOrEqualTo(RetrievalOrchestrator.SESSION_LOCK_STRIPES);
            assertThat(orchestrator.lockFor("never-ingested-0")).isSameAs(first);
            assertThat(first.isLocked()).isFalse();
        }

        @Test
        void concurrentIngestsOfOneSessionLeaveOneCollection() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<CollectionHandle>> futures = new ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    int rows = 20 + i * 100;
                    futures.add(pool.submit(() -> {
                        start.await();
                        return orchestrator.ingest("shared", TestDatasets.clinical(rows));
                    }));
                }
                start.countDown();
                for (Future<CollectionHandle> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(store.listCollections()).hasSize(1);
            CollectionInfo info = orchestrator.info("shared").orElseThrow();
            int rows = info.getMetadata().get("row_count").asNumber().intValue();
            assertThat(info.getCount())
                    .isEqualTo(new DatasetChunker().chunk(TestDatasets.clinical(rows)).size());
        }
    }
}

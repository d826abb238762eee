package com.statassist.rag.store;

import com.statassist.rag.model.ContextValue;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * {@link VectorIndexStore} keeping one LangChain4j {@link InMemoryEmbeddingStore} per
 * collection. Relevance scores reported by LangChain4j are converted back to cosine
 * distance.
 */
@Component
@Slf4j
public class InMemoryVectorIndexStore implements VectorIndexStore {

    private final ConcurrentMap<String, StoredCollection> collections = new ConcurrentHashMap<>();

    @Override
    public CollectionHandle createCollection(String name, Map<String, ContextValue> metadata,
                                             List<IndexRecord> records) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Collection name is required");
        }
        if (collections.containsKey(name)) {
            throw new IllegalStateException("Collection already exists: " + name);
        }
        StoredCollection created = new StoredCollection(
                new CollectionHandle(name, UUID.randomUUID().toString(), metadata));
        created.addAll(records);

        // published only after population
        StoredCollection existing = collections.putIfAbsent(name, created);
        if (existing != null) {
            throw new IllegalStateException("Collection already exists: " + name);
        }
        log.debug("Created collection {} with {} records", name, records.size());
        return created.handle;
    }

    @Override
    public boolean deleteCollection(String name) {
        if (name == null) {
            return false;
        }
        boolean removed = collections.remove(name) != null;
        if (removed) {
            log.debug("Deleted collection {}", name);
        }
        return removed;
    }

    @Override
    public void insert(CollectionHandle handle, List<IndexRecord> records) {
        resolve(handle).addAll(records);
        log.debug("Inserted {} records into {}", records.size(), handle.getName());
    }

    @Override
    public List<IndexCandidate> query(CollectionHandle handle, float[] queryVector, int topK, Filter filter) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive, got " + topK);
        }
        StoredCollection collection = resolve(handle);
        if (collection.size.get() == 0) {
            return List.of();
        }
        collection.checkDimension(queryVector);

        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(Embedding.from(queryVector))
                .maxResults(topK)
                .minScore(0.0)
                .filter(filter)
                .build();

        List<IndexCandidate> candidates = new ArrayList<>();
        for (EmbeddingMatch<TextSegment> match : collection.embeddings.search(request).matches()) {
            double cosine = CosineSimilarity.fromRelevanceScore(match.score());
            candidates.add(new IndexCandidate(
                    match.embeddingId(),
                    match.embedded().text(),
                    toStringMap(match.embedded().metadata()),
                    1.0 - cosine));
        }
        candidates.sort(Comparator.comparingDouble(IndexCandidate::getDistance));
        return candidates;
    }

    @Override
    public Optional<CollectionHandle> getCollection(String name) {
        StoredCollection collection = name == null ? null : collections.get(name);
        return Optional.ofNullable(collection).map(stored -> stored.handle);
    }

    @Override
    public int count(CollectionHandle handle) {
        return resolve(handle).size.get();
    }

    @Override
    public List<CollectionHandle> listCollections() {
        return collections.values().stream()
                .map(stored -> stored.handle)
                .sorted(Comparator.comparing(CollectionHandle::getName))
                .collect(Collectors.toList());
    }

    private StoredCollection resolve(CollectionHandle handle) {
        StoredCollection collection = collections.get(handle.getName());
        if (collection == null || !collection.handle.getGeneration().equals(handle.getGeneration())) {
            throw new IllegalStateException("Collection no longer exists: " + handle.getName());
        }
        return collection;
    }

    private static Map<String, String> toStringMap(Metadata metadata) {
        Map<String, String> values = new LinkedHashMap<>();
        metadata.toMap().forEach((key, value) -> values.put(key, String.valueOf(value)));
        return values;
    }

    private static final class StoredCollection {

        private final CollectionHandle handle;
        private final InMemoryEmbeddingStore<TextSegment> embeddings = new InMemoryEmbeddingStore<>();
        private final AtomicInteger size = new AtomicInteger();
        private volatile int dimension = -1;

        private StoredCollection(CollectionHandle handle) {
            this.handle = handle;
        }

        private void addAll(List<IndexRecord> records) {
            for (IndexRecord record : records) {
                checkDimension(record.getVector());
                TextSegment segment = TextSegment.from(record.getDocument(), new Metadata(record.getMetadata()));
                embeddings.add(record.getId(), Embedding.from(record.getVector()), segment);
                size.incrementAndGet();
            }
        }

        private synchronized void checkDimension(float[] vector) {
            if (vector == null || vector.length == 0) {
                throw new IllegalArgumentException("Vector must not be empty");
            }
            if (dimension < 0) {
                dimension = vector.length;
            } else if (dimension != vector.length) {
                throw new IllegalArgumentException("Vector dimension " + vector.length
                        + " does not match collection dimension " + dimension);
            }
        }
    }
}

package com.statassist.rag.store;

import com.statassist.rag.model.ContextValue;
import dev.langchain4j.store.embedding.filter.Filter;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named collections of vectors with their document text and metadata.
 * Collections are isolated from each other; operations on one never observe another.
 */
public interface VectorIndexStore {

    /**
     * Creates an empty collection.
     *
     * @throws IllegalStateException when a collection with this name already exists
     */
    default CollectionHandle createCollection(String name, Map<String, ContextValue> metadata) {
        return createCollection(name, metadata, List.of());
    }

    /**
     * Creates a collection holding {@code records}. The collection becomes visible to
     * {@link #getCollection} and {@link #query} only once every record is stored; if any
     * record is rejected nothing is published.
     *
     * @throws IllegalStateException when a collection with this name already exists
     */
    CollectionHandle createCollection(String name, Map<String, ContextValue> metadata, List<IndexRecord> records);

    /**
     * @return true when a collection was removed, false when none existed
     */
    boolean deleteCollection(String name);

    void insert(CollectionHandle handle, List<IndexRecord> records);

    /**
     * Nearest neighbours by ascending distance.
     *
     * @param filter optional metadata condition, null for none
     */
    List<IndexCandidate> query(CollectionHandle handle, float[] queryVector, int topK, Filter filter);

    Optional<CollectionHandle> getCollection(String name);

    int count(CollectionHandle handle);

    List<CollectionHandle> listCollections();
}

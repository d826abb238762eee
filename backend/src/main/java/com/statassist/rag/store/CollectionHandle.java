package com.statassist.rag.store;

import com.statassist.rag.model.ContextValue;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reference to one collection in a {@link VectorIndexStore}. The {@code generation} tells
 * apart a collection from a later one created under the same name.
 */
@Value
public class CollectionHandle {

    String name;

    String generation;

    Map<String, ContextValue> metadata;

    public CollectionHandle(String name, String generation, Map<String, ContextValue> metadata) {
        this.name = name;
        this.generation = generation;
        this.metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}

package com.statassist.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One retrievable excerpt describing part of a dataset.
 * {@code content} is the text that gets embedded; the remaining fields travel with it
 * into the vector store as serialised metadata.
 */
@Value
public class DataChunk {

    String id;

    String content;

    @JsonProperty("chunk_type")
    ChunkType chunkType;

    List<String> variables;

    @JsonProperty("data_types")
    Map<String, String> dataTypes;

    @JsonProperty("statistical_context")
    Map<String, ContextValue> statisticalContext;

    Map<String, ContextValue> metadata;

    @Builder
    public DataChunk(String id,
                     String content,
                     ChunkType chunkType,
                     List<String> variables,
                     Map<String, String> dataTypes,
                     Map<String, ContextValue> statisticalContext,
                     Map<String, ContextValue> metadata) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Chunk id is required");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Chunk content must not be empty");
        }
        if (chunkType == null) {
            throw new IllegalArgumentException("Chunk type is required");
        }
        this.id = id;
        this.content = content;
        this.chunkType = chunkType;
        this.variables = variables == null ? List.of() : List.copyOf(variables);
        this.dataTypes = unmodifiable(dataTypes);
        this.statisticalContext = unmodifiable(statisticalContext);
        this.metadata = unmodifiable(metadata);
    }

    private static <V> Map<String, V> unmodifiable(Map<String, V> source) {
        return source == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

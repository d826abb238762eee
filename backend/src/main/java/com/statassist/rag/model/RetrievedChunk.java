package com.statassist.rag.model;

import lombok.Value;

import java.util.List;

/**
 * A vector-search hit with the chunk fields re-ranking needs.
 * {@code chunkType} is null when the stored label is not recognised.
 */
@Value
public class RetrievedChunk {

    String id;

    String content;

    ChunkType chunkType;

    List<String> variables;

    double distance;
}

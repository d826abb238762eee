package com.statassist.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A retrieved chunk with the factors of its final score:
 * {@code score = similarity * affinity * variableBonus}, {@code similarity = 1 - distance}.
 */
@Value
@Builder
public class RankedChunk {

    String id;

    String content;

    @JsonProperty("chunk_type")
    ChunkType chunkType;

    List<String> variables;

    double distance;

    double similarity;

    double affinity;

    @JsonProperty("variable_bonus")
    double variableBonus;

    double score;
}

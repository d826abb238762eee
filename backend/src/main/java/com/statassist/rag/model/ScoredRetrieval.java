package com.statassist.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class ScoredRetrieval {

    @JsonProperty("augmented_query")
    String augmentedQuery;

    QueryIntent intent;

    List<RankedChunk> ranked;

    public RetrievalResult toResult() {
        return new RetrievalResult(
                ranked.stream().map(RankedChunk::getContent).collect(Collectors.toList()),
                intent);
    }
}

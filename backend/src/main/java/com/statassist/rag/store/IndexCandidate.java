package com.statassist.rag.store;

import lombok.Value;

import java.util.Map;

/**
 * A nearest-neighbour hit. {@code distance} is cosine distance, 0 for identical direction.
 */
@Value
public class IndexCandidate {

    String id;

    String document;

    Map<String, String> metadata;

    double distance;
}

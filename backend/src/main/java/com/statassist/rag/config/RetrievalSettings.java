package com.statassist.rag.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tunables of the ingest and query lifecycle, bound from {@code rag.*} properties.
 */
@Value
@Builder
public class RetrievalSettings {

    @Builder.Default
    int defaultTopK = 5;

    @Builder.Default
    int maxTopK = 20;

    @Builder.Default
    int rowChunkSize = 100;

    @Builder.Default
    Duration ingestTimeout = Duration.ofMinutes(5);

    @Builder.Default
    Duration queryTimeout = Duration.ofSeconds(30);

    /** Caps a requested top-k to {@code [1, maxTopK]}; null selects the default. */
    public int resolveTopK(Integer requested) {
        if (requested == null) {
            return Math.min(defaultTopK, maxTopK);
        }
        return Math.max(1, Math.min(requested, maxTopK));
    }
}

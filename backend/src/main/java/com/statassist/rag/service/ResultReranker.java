package com.statassist.rag.service;

import com.statassist.rag.config.RerankingPolicy;
import com.statassist.rag.model.QueryIntent;
import com.statassist.rag.model.RankedChunk;
import com.statassist.rag.model.RetrievedChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Re-scores vector-search hits against the query intent.
 * <p>
 * {@code score = (1 - distance) * affinity(intent type, chunk type) * bonus}, where the
 * bonus applies when any intent variable names one of the chunk's columns (compared
 * case-insensitively). Results are sorted by descending score; equal scores keep the
 * store's order.
 */
@Service
@Slf4j
public class ResultReranker {

    private final RerankingPolicy policy;

    public ResultReranker(RerankingPolicy policy) {
        this.policy = policy;
    }

    public List<RankedChunk> rerank(List<RetrievedChunk> candidates, QueryIntent intent) {
        Set<String> wanted = intent.getVariables().stream()
                .map(variable -> variable.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        List<RankedChunk> ranked = new ArrayList<>(candidates.size());
        for (RetrievedChunk candidate : candidates) {
            double similarity = 1.0 - candidate.getDistance();
            double affinity = policy.affinity(intent.getType(), candidate.getChunkType());
            double bonus = overlaps(candidate.getVariables(), wanted) ? policy.getVariableOverlapBonus() : 1.0;

            ranked.add(RankedChunk.builder()
                    .id(candidate.getId())
                    .content(candidate.getContent())
                    .chunkType(candidate.getChunkType())
                    .variables(candidate.getVariables())
                    .distance(candidate.getDistance())
                    .similarity(similarity)
                    .affinity(affinity)
                    .variableBonus(bonus)
                    .score(similarity * affinity * bonus)
                    .build());
        }

        // List.sort is stable
        ranked.sort(Comparator.comparingDouble(RankedChunk::getScore).reversed());

        if (log.isDebugEnabled()) {
            ranked.forEach(chunk -> log.debug("   {} score={} (sim={}, affinity={}, bonus={})",
                    chunk.getChunkType() == null ? "unknown" : chunk.getChunkType().getLabel(),
                    String.format("%.4f", chunk.getScore()), String.format("%.4f", chunk.getSimilarity()),
                    chunk.getAffinity(), chunk.getVariableBonus()));
        }
        return ranked;
    }

    private static boolean overlaps(List<String> chunkVariables, Set<String> wanted) {
        if (wanted.isEmpty()) {
            return false;
        }
        for (String variable : chunkVariables) {
            if (wanted.contains(variable.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}

package com.statassist.rag.service;

import com.statassist.rag.config.RerankingPolicy;
import com.statassist.rag.model.ChunkType;
import com.statassist.rag.model.QueryIntent;
import com.statassist.rag.model.QueryType;
import com.statassist.rag.model.RankedChunk;
import com.statassist.rag.model.RetrievedChunk;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ResultRerankerTest {

    private final ResultReranker reranker = new ResultReranker(RerankingPolicy.defaults());

    private static QueryIntent intent(QueryType type, String... variables) {
        return QueryIntent.builder().type(type).confidence(1.0).variables(Set.of(variables)).build();
    }

    private static RetrievedChunk chunk(String id, ChunkType type, double distance, String... variables) {
        return new RetrievedChunk(id, "content " + id, type, List.of(variables), distance);
    }

    @Test
    void correlationAffinityCanOvertakeCloserChunk() {
        List<RankedChunk> ranked = reranker.rerank(List.of(
                chunk("rows", ChunkType.ROW_GROUP, 0.3),
                chunk("matrix", ChunkType.CORRELATION_MATRIX, 0.5)),
                intent(QueryType.CORRELATION));

        // 0.7 * 1.0 versus 0.5 * 1.8
        assertThat(ranked).extracting(RankedChunk::getId).containsExactly("matrix", "rows");
        assertThat(ranked.get(0).getScore()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void variableOverlapIsCaseInsensitive() {
        List<RankedChunk> ranked = reranker.rerank(List.of(
                chunk("other", ChunkType.ROW_GROUP, 0.2, "income"),
                chunk("match", ChunkType.ROW_GROUP, 0.3, "Age")),
                intent(QueryType.INFERENTIAL, "age"));

        assertThat(ranked.get(0).getId()).isEqualTo("match");
        assertThat(ranked.get(0).getVariableBonus()).isEqualTo(1.3);
        assertThat(ranked.get(1).getVariableBonus()).isEqualTo(1.0);
    }

    @Test
    void equalScoresKeepSearchOrder() {
        List<RankedChunk> ranked = reranker.rerank(List.of(
                chunk("first", ChunkType.ROW_GROUP, 0.4),
                chunk("second", ChunkType.ROW_GROUP, 0.4)),
                intent(QueryType.TEMPORAL));

        assertThat(ranked).extracting(RankedChunk::getId).containsExactly("first", "second");
    }

    @Test
    void unknownChunkTypeGetsNeutralAffinity() {
        List<RankedChunk> ranked = reranker.rerank(List.of(chunk("x", null, 0.1)), intent(QueryType.DESCRIPTIVE));

        assertThat(ranked.get(0).getAffinity()).isEqualTo(1.0);
        assertThat(ranked.get(0).getScore()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertThat(reranker.rerank(List.of(), intent(QueryType.SUMMARY))).isEmpty();
    }

    @Test
    void customPolicyOverridesDefaults() {
        RerankingPolicy policy = RerankingPolicy.builder()
                .affinity(QueryType.OUTLIER, ChunkType.COLUMN_GROUP, 2.0)
                .variableOverlapBonus(1.0)
                .build();

        assertThat(policy.affinity(QueryType.OUTLIER, ChunkType.COLUMN_GROUP)).isEqualTo(2.0);
        assertThat(policy.affinity(QueryType.CORRELATION, ChunkType.CORRELATION_MATRIX)).isEqualTo(1.8);
        assertThatThrownBy(() -> RerankingPolicy.builder().variableOverlapBonus(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scoreFallsAsDistanceGrows() {
        List<RankedChunk> ranked = reranker.rerank(List.of(
                chunk("d3", ChunkType.COLUMN_GROUP, 0.9, "age"),
                chunk("d1", ChunkType.COLUMN_GROUP, 0.1, "age"),
                chunk("d2", ChunkType.COLUMN_GROUP, 0.5, "age")),
                intent(QueryType.DESCRIPTIVE, "age"));

        assertThat(ranked).extracting(RankedChunk::getId).containsExactly("d1", "d2", "d3");
    }
}

package com.statassist.rag.dataset;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DatasetTest {

    private static Dataset sample() {
        return Dataset.builder("sample")
                .column("x", ColumnType.INTEGER)
                .column("y", ColumnType.DECIMAL)
                .column("label", ColumnType.TEXT)
                .row(1, 2.0, "a")
                .row(2, 4.0, "b")
                .row(3, 6.0, "a")
                .row(4, null, "a")
                .build();
    }

    @Test
    void partitionsColumnsByType() {
        Dataset dataset = sample();

        assertThat(dataset.numericColumns()).containsExactly("x", "y");
        assertThat(dataset.categoricalColumns()).containsExactly("label");
        assertThat(dataset.dataTypes()).containsExactly(
                Map.entry("x", "int64"), Map.entry("y", "float64"), Map.entry("label", "object"));
    }

    @Test
    void summarySkipsMissingValues() {
        ColumnSummary summary = sample().summary("y");

        assertThat(summary.getCount()).isEqualTo(3);
        assertThat(summary.getMean()).isEqualTo(4.0);
        assertThat(summary.getStd()).isCloseTo(2.0, within(1e-9));
        assertThat(summary.getMin()).isEqualTo(2.0);
        assertThat(summary.getMedian()).isEqualTo(4.0);
        assertThat(summary.getQ1()).isEqualTo(3.0);
        assertThat(summary.getMax()).isEqualTo(6.0);
    }

    @Test
    void summaryOfEmptyColumnIsNaN() {
        ColumnSummary summary = sample().slice(0, 0).summary("x");

        assertThat(summary.getCount()).isZero();
        assertThat(summary.getMean()).isNaN();
    }

    @Test
    void correlationUsesPairwiseCompleteRows() {
        assertThat(sample().correlation("x", "y")).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void correlationMatrixIsSymmetricWithUnitDiagonal() {
        Map<String, Map<String, Double>> matrix = sample().correlationMatrix(List.of("x", "y"));

        assertThat(matrix.get("x").get("x")).isEqualTo(1.0);
        assertThat(matrix.get("x").get("y")).isCloseTo(matrix.get("y").get("x"), within(1e-12));
    }

    @Test
    void valueCountsAreMostFrequentFirst() {
        Dataset dataset = sample();

        assertThat(dataset.valueCounts("label")).containsExactly(Map.entry("a", 3L), Map.entry("b", 1L));
        assertThat(dataset.mode("label")).contains("a");
        assertThat(dataset.uniqueCount("label")).isEqualTo(2);
    }

    @Test
    void sliceClampsBounds() {
        Dataset dataset = sample();

        assertThat(dataset.slice(2, 99).rowCount()).isEqualTo(2);
        assertThat(dataset.slice(10, 20).rowCount()).isZero();
        assertThat(dataset.slice(1, 3).value(0, "x")).isEqualTo(2L);
    }

    @Test
    void countsMissingCells() {
        assertThat(sample().missingCount("y")).isEqualTo(1);
        assertThat(sample().totalMissing()).isEqualTo(1);
    }

    @Test
    void rejectsNumericOperationsOnText() {
        assertThatThrownBy(() -> sample().summary("label"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sample().values("missing"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsRowsOfWrongWidth() {
        Dataset.Builder builder = Dataset.builder("bad").column("x", ColumnType.INTEGER);

        assertThatThrownBy(() -> builder.row(1, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatsCellsForChunkText() {
        assertThat(Dataset.formatCell(null)).isEqualTo("NaN");
        assertThat(Dataset.formatCell(3.0)).isEqualTo("3.0");
        assertThat(Dataset.formatCell(2.5)).isEqualTo("2.5");
        assertThat(Dataset.formatCell(7L)).isEqualTo("7");
    }
}

package com.statassist.rag.chunking;

import com.statassist.rag.dataset.ColumnSummary;
import com.statassist.rag.dataset.Dataset;
import com.statassist.rag.model.ChunkType;
import com.statassist.rag.model.ContextValue;
import com.statassist.rag.model.DataChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Turns a dataset into retrievable {@link DataChunk}s using four independent strategies:
 * <ol>
 *   <li>Row groups: consecutive blocks of {@code rowChunkSize} rows</li>
 *   <li>Column groups: numeric, categorical and domain-recognised column buckets</li>
 *   <li>Statistical summary: exactly one per dataset</li>
 *   <li>Correlation matrix: one per dataset with more than one numeric column</li>
 * </ol>
 * A failing strategy is logged and skipped; the others still contribute their chunks.
 */
@Service
@Slf4j
public class DatasetChunker {

    public static final int DEFAULT_ROW_CHUNK_SIZE = 100;

    /** Absolute correlation above which a pair is listed as strong. */
    public static final double STRONG_CORRELATION_THRESHOLD = 0.5;

    private static final int SAMPLE_ROWS = 3;
    private static final int TOP_CATEGORIES_IN_ROW_CHUNK = 3;
    private static final int TOP_CATEGORIES_IN_COLUMN_CHUNK = 5;

    /**
     * Column-name fragments that put a column into the domain ("medical") bucket.
     * Matching is by substring on the lower-cased column name.
     */
    public static final List<String> DOMAIN_VOCABULARY = List.of(
            "age", "gender", "sex", "height", "weight", "bmi", "blood_pressure",
            "heart_rate", "temperature", "cholesterol", "glucose", "medication",
            "treatment", "diagnosis", "outcome", "survival", "mortality");

    public List<DataChunk> chunk(Dataset dataset) {
        return chunk(dataset, DEFAULT_ROW_CHUNK_SIZE);
    }

    public List<DataChunk> chunk(Dataset dataset, int rowChunkSize) {
        if (dataset == null) {
            throw new IllegalArgumentException("Dataset is required");
        }
        if (rowChunkSize <= 0) {
            throw new IllegalArgumentException("Row chunk size must be positive, got " + rowChunkSize);
        }

        List<DataChunk> chunks = new ArrayList<>();
        chunks.addAll(runStrategy("row_group", dataset, () -> createRowChunks(dataset, rowChunkSize)));
        chunks.addAll(runStrategy("column_group", dataset, () -> createColumnChunks(dataset)));
        chunks.addAll(runStrategy("statistical_summary", dataset, () -> createStatisticalChunks(dataset)));
        chunks.addAll(runStrategy("correlation_matrix", dataset, () -> createCorrelationChunks(dataset)));

        log.info("Chunked dataset '{}' ({} rows x {} columns) into {} chunks",
                dataset.name(), dataset.rowCount(), dataset.columnCount(), chunks.size());
        return chunks;
    }

    private List<DataChunk> runStrategy(String strategy, Dataset dataset, Supplier<List<DataChunk>> body) {
        try {
            List<DataChunk> produced = body.get();
            log.debug("Strategy {} produced {} chunks for '{}'", strategy, produced.size(), dataset.name());
            return produced;
        } catch (RuntimeException e) {
            log.error("❌ Chunking strategy {} failed for dataset '{}': {}",
                    strategy, dataset.name(), e.getMessage(), e);
            return List.of();
        }
    }

    // ---------------------------------------------------------------- row groups

    List<DataChunk> createRowChunks(Dataset dataset, int rowChunkSize) {
        List<DataChunk> chunks = new ArrayList<>();
        int rows = dataset.rowCount();

        for (int start = 0; start < rows; start += rowChunkSize) {
            int end = Math.min(start + rowChunkSize, rows);
            Dataset slice = dataset.slice(start, end);

            Map<String, ContextValue> metadata = new LinkedHashMap<>();
            metadata.put("start_row", ContextValue.of(start));
            metadata.put("end_row", ContextValue.of(end));
            metadata.put("row_count", ContextValue.of(slice.rowCount()));
            metadata.put("chunk_index", ContextValue.of(start / rowChunkSize));

            chunks.add(DataChunk.builder()
                    .id(newId())
                    .content(rowChunkContent(slice, start))
                    .chunkType(ChunkType.ROW_GROUP)
                    .variables(dataset.columnNames())
                    .dataTypes(dataset.dataTypes())
                    .statisticalContext(rowChunkStats(slice))
                    .metadata(metadata)
                    .build());
        }
        return chunks;
    }

    private String rowChunkContent(Dataset slice, int startIndex) {
        StringBuilder content = new StringBuilder();
        content.append(String.format("Data subset from rows %d to %d:\n\n",
                startIndex, startIndex + slice.rowCount() - 1));

        content.append("Sample statistics:\n");
        for (String column : slice.numericColumns()) {
            ColumnSummary summary = slice.summary(column);
            content.append(String.format(Locale.ROOT, "- %s: mean=%.2f, std=%.2f\n",
                    column, summary.getMean(), summary.getStd()));
        }
        for (String column : slice.categoricalColumns()) {
            content.append("- ").append(column).append(": ")
                    .append(formatCounts(top(slice.valueCounts(column), TOP_CATEGORIES_IN_ROW_CHUNK)))
                    .append('\n');
        }

        content.append("\nSample data:\n");
        content.append(sampleTable(slice, startIndex));
        return content.toString();
    }

    private String sampleTable(Dataset slice, int startIndex) {
        List<List<String>> rows = new ArrayList<>();
        for (int row = 0; row < Math.min(SAMPLE_ROWS, slice.rowCount()); row++) {
            List<String> line = new ArrayList<>();
            line.add(String.valueOf(startIndex + row));
            for (String column : slice.columnNames()) {
                line.add(Dataset.formatCell(slice.value(row, column)));
            }
            rows.add(line);
        }
        return TextTable.render(slice.columnNames(), rows);
    }

    private Map<String, ContextValue> rowChunkStats(Dataset slice) {
        Map<String, ContextValue> stats = new LinkedHashMap<>();
        stats.put("row_count", ContextValue.of(slice.rowCount()));
        stats.put("column_count", ContextValue.of(slice.columnCount()));
        stats.put("missing_values", ContextValue.of(slice.totalMissing()));
        stats.put("numeric_columns", ContextValue.of(slice.numericColumns().size()));
        stats.put("categorical_columns", ContextValue.of(slice.categoricalColumns().size()));

        List<String> numeric = slice.numericColumns();
        if (!numeric.isEmpty()) {
            Map<String, Double> means = new LinkedHashMap<>();
            Map<String, Double> stds = new LinkedHashMap<>();
            Map<String, Double> mins = new LinkedHashMap<>();
            Map<String, Double> maxs = new LinkedHashMap<>();
            for (String column : numeric) {
                ColumnSummary summary = slice.summary(column);
                means.put(column, summary.getMean());
                stds.put(column, summary.getStd());
                mins.put(column, summary.getMin());
                maxs.put(column, summary.getMax());
            }
            Map<String, ContextValue> numericStats = new LinkedHashMap<>();
            numericStats.put("means", ContextValue.ofNumbers(means));
            numericStats.put("stds", ContextValue.ofNumbers(stds));
            numericStats.put("mins", ContextValue.ofNumbers(mins));
            numericStats.put("maxs", ContextValue.ofNumbers(maxs));
            stats.put("numeric_stats", ContextValue.of(numericStats));
        }
        return stats;
    }

    // ------------------------------------------------------------- column groups

    List<DataChunk> createColumnChunks(Dataset dataset) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        groups.put("numeric", dataset.numericColumns());
        groups.put("categorical", dataset.categoricalColumns());
        groups.put("medical", domainColumns(dataset));

        List<DataChunk> chunks = new ArrayList<>();
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            List<String> columns = group.getValue();
            if (columns.isEmpty()) {
                continue;
            }

            Map<String, ContextValue> metadata = new LinkedHashMap<>();
            metadata.put("group_type", ContextValue.of(group.getKey()));
            metadata.put("column_count", ContextValue.of(columns.size()));
            metadata.put("medical_context", ContextValue.of("medical".equals(group.getKey())));

            chunks.add(DataChunk.builder()
                    .id(newId())
                    .content(columnChunkContent(dataset, columns, group.getKey()))
                    .chunkType(ChunkType.COLUMN_GROUP)
                    .variables(columns)
                    .dataTypes(dataset.dataTypes(columns))
                    .statisticalContext(columnGroupStats(dataset, columns))
                    .metadata(metadata)
                    .build());
        }
        return chunks;
    }

    private List<String> domainColumns(Dataset dataset) {
        return dataset.columnNames().stream()
                .filter(column -> {
                    String lower = column.toLowerCase(Locale.ROOT);
                    return DOMAIN_VOCABULARY.stream().anyMatch(lower::contains);
                })
                .collect(Collectors.toList());
    }

    private String columnChunkContent(Dataset dataset, List<String> columns, String groupName) {
        StringBuilder content = new StringBuilder();
        content.append(Character.toUpperCase(groupName.charAt(0)))
                .append(groupName.substring(1))
                .append(" variables analysis:\n\n");

        for (String column : columns) {
            content.append("Variable: ").append(column).append('\n');
            content.append("Type: ").append(dataset.columnType(column).getLabel()).append('\n');

            if (dataset.columnType(column).isNumeric()) {
                ColumnSummary summary = dataset.summary(column);
                content.append(String.format(Locale.ROOT, "Range: %.2f to %.2f\n", summary.getMin(), summary.getMax()));
                content.append(String.format(Locale.ROOT, "Mean: %.2f, Std: %.2f\n", summary.getMean(), summary.getStd()));
            } else {
                Map<String, Long> counts = dataset.valueCounts(column);
                content.append("Categories: ").append(new ArrayList<>(top(counts, TOP_CATEGORIES_IN_COLUMN_CHUNK).keySet()))
                        .append('\n');
                if (counts.isEmpty()) {
                    content.append("Most frequent: none (0 occurrences)\n");
                } else {
                    Map.Entry<String, Long> first = counts.entrySet().iterator().next();
                    content.append("Most frequent: ").append(first.getKey())
                            .append(" (").append(first.getValue()).append(" occurrences)\n");
                }
            }

            content.append("Missing values: ").append(dataset.missingCount(column)).append("\n\n");
        }
        return content.toString();
    }

    private Map<String, ContextValue> columnGroupStats(Dataset dataset, List<String> columns) {
        Map<String, ContextValue> stats = new LinkedHashMap<>();
        long missing = columns.stream().mapToLong(dataset::missingCount).sum();
        stats.put("column_count", ContextValue.of(columns.size()));
        stats.put("total_values", ContextValue.of((long) columns.size() * dataset.rowCount()));
        stats.put("missing_values", ContextValue.of(missing));

        List<String> numeric = columns.stream()
                .filter(column -> dataset.columnType(column).isNumeric())
                .collect(Collectors.toList());

        if (numeric.isEmpty()) {
            Map<String, ContextValue> categorical = new LinkedHashMap<>();
            for (String column : columns) {
                Map<String, ContextValue> entry = new LinkedHashMap<>();
                entry.put("unique_count", ContextValue.of(dataset.uniqueCount(column)));
                entry.put("most_frequent", ContextValue.of(dataset.mode(column).orElse(null)));
                categorical.put(column, ContextValue.of(entry));
            }
            stats.put("categorical_stats", ContextValue.of(categorical));
        } else {
            Map<String, Double> means = new LinkedHashMap<>();
            Map<String, Double> stds = new LinkedHashMap<>();
            for (String column : numeric) {
                ColumnSummary summary = dataset.summary(column);
                means.put(column, summary.getMean());
                stds.put(column, summary.getStd());
            }
            Map<String, ContextValue> numericStats = new LinkedHashMap<>();
            numericStats.put("means", ContextValue.ofNumbers(means));
            numericStats.put("stds", ContextValue.ofNumbers(stds));
            numericStats.put("correlations", numeric.size() > 1
                    ? ContextValue.ofNumberTable(dataset.correlationMatrix(numeric))
                    : ContextValue.of(Map.of()));
            stats.put("numeric_stats", ContextValue.of(numericStats));
        }
        return stats;
    }

    // -------------------------------------------------------- statistical summary

    List<DataChunk> createStatisticalChunks(Dataset dataset) {
        Map<String, ContextValue> metadata = new LinkedHashMap<>();
        metadata.put("summary_type", ContextValue.of("comprehensive"));
        metadata.put("includes_all_variables", ContextValue.of(true));

        return List.of(DataChunk.builder()
                .id(newId())
                .content(statisticalSummaryContent(dataset))
                .chunkType(ChunkType.STATISTICAL_SUMMARY)
                .variables(dataset.columnNames())
                .dataTypes(dataset.dataTypes())
                .statisticalContext(comprehensiveStats(dataset))
                .metadata(metadata)
                .build());
    }

    private String statisticalSummaryContent(Dataset dataset) {
        StringBuilder content = new StringBuilder("Comprehensive Dataset Statistical Summary:\n\n");
        content.append(String.format("Dataset shape: %d rows, %d columns\n", dataset.rowCount(), dataset.columnCount()));
        content.append("Data types: ").append(formatCounts(typeCounts(dataset))).append('\n');
        content.append("Missing values: ").append(dataset.totalMissing()).append(" total\n\n");

        List<String> numeric = dataset.numericColumns();
        if (!numeric.isEmpty()) {
            content.append("Numeric Variables Summary:\n");
            content.append(describeTable(dataset, numeric));
            content.append("\n\n");
        }

        List<String> categorical = dataset.categoricalColumns();
        if (!categorical.isEmpty()) {
            content.append("Categorical Variables Summary:\n");
            for (String column : categorical) {
                content.append("- ").append(column).append(": ")
                        .append(dataset.uniqueCount(column)).append(" unique values\n");
            }
            content.append('\n');
        }
        return content.toString();
    }

    private String describeTable(Dataset dataset, List<String> numeric) {
        Map<String, Map<String, Double>> describe = new LinkedHashMap<>();
        for (String column : numeric) {
            describe.put(column, dataset.summary(column).asDescribeRows());
        }
        List<List<String>> rows = new ArrayList<>();
        for (String statistic : describe.values().iterator().next().keySet()) {
            List<String> line = new ArrayList<>();
            line.add(statistic);
            for (String column : numeric) {
                line.add(formatNumber(describe.get(column).get(statistic), 6));
            }
            rows.add(line);
        }
        return TextTable.render(numeric, rows);
    }

    private Map<String, Long> typeCounts(Dataset dataset) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String label : dataset.dataTypes().values()) {
            counts.merge(label, 1L, Long::sum);
        }
        return sortByCountDescending(counts);
    }

    private Map<String, ContextValue> comprehensiveStats(Dataset dataset) {
        Map<String, ContextValue> stats = new LinkedHashMap<>();
        stats.put("dataset_shape", ContextValue.of(List.of(
                ContextValue.of(dataset.rowCount()), ContextValue.of(dataset.columnCount()))));
        stats.put("data_types", ContextValue.ofTexts(dataset.dataTypes()));

        Map<String, Long> missing = new LinkedHashMap<>();
        for (String column : dataset.columnNames()) {
            missing.put(column, dataset.missingCount(column));
        }
        stats.put("missing_values", ContextValue.ofNumbers(missing));

        List<String> numeric = dataset.numericColumns();
        if (!numeric.isEmpty()) {
            Map<String, Map<String, Double>> describe = new LinkedHashMap<>();
            for (String column : numeric) {
                describe.put(column, dataset.summary(column).asDescribeRows());
            }
            stats.put("descriptive_stats", ContextValue.ofNumberTable(describe));
            if (numeric.size() > 1) {
                stats.put("correlation_matrix", ContextValue.ofNumberTable(dataset.correlationMatrix(numeric)));
            }
        }

        List<String> categorical = dataset.categoricalColumns();
        if (!categorical.isEmpty()) {
            Map<String, ContextValue> categoricalStats = new LinkedHashMap<>();
            for (String column : categorical) {
                Map<String, ContextValue> entry = new LinkedHashMap<>();
                entry.put("unique_count", ContextValue.of(dataset.uniqueCount(column)));
                entry.put("value_counts", ContextValue.ofNumbers(dataset.valueCounts(column)));
                categoricalStats.put(column, ContextValue.of(entry));
            }
            stats.put("categorical_stats", ContextValue.of(categoricalStats));
        }
        return stats;
    }

    // --------------------------------------------------------- correlation matrix

    List<DataChunk> createCorrelationChunks(Dataset dataset) {
        List<String> numeric = dataset.numericColumns();
        if (numeric.size() <= 1) {
            return List.of();
        }

        Map<String, Map<String, Double>> matrix = dataset.correlationMatrix(numeric);
        List<StrongCorrelation> strong = strongCorrelations(numeric, matrix);

        Map<String, ContextValue> stats = new LinkedHashMap<>();
        stats.put("correlation_matrix", ContextValue.ofNumberTable(matrix));
        stats.put("strong_correlations", ContextValue.of(strong.stream()
                .map(StrongCorrelation::toContextValue)
                .collect(Collectors.toList())));

        Map<String, ContextValue> metadata = new LinkedHashMap<>();
        metadata.put("analysis_type", ContextValue.of("correlation"));
        metadata.put("variable_count", ContextValue.of(numeric.size()));
        metadata.put("strong_pair_count", ContextValue.of(strong.size()));

        return List.of(DataChunk.builder()
                .id(newId())
                .content(correlationContent(numeric, matrix, strong))
                .chunkType(ChunkType.CORRELATION_MATRIX)
                .variables(numeric)
                .dataTypes(dataset.dataTypes(numeric))
                .statisticalContext(stats)
                .metadata(metadata)
                .build());
    }

    private List<StrongCorrelation> strongCorrelations(List<String> numeric, Map<String, Map<String, Double>> matrix) {
        List<StrongCorrelation> strong = new ArrayList<>();
        for (int i = 0; i < numeric.size(); i++) {
            for (int j = i + 1; j < numeric.size(); j++) {
                double r = matrix.get(numeric.get(i)).get(numeric.get(j));
                if (Math.abs(r) > STRONG_CORRELATION_THRESHOLD) {
                    strong.add(new StrongCorrelation(numeric.get(i), numeric.get(j), r));
                }
            }
        }
        return strong;
    }

    private String correlationContent(List<String> numeric,
                                      Map<String, Map<String, Double>> matrix,
                                      List<StrongCorrelation> strong) {
        StringBuilder content = new StringBuilder("Correlation Analysis:\n\n");
        if (strong.isEmpty()) {
            content.append("No strong correlations found (|r| > 0.5)\n");
        } else {
            content.append("Strong correlations (|r| > 0.5):\n");
            for (StrongCorrelation pair : strong) {
                content.append(String.format(Locale.ROOT, "- %s ↔ %s: %.3f\n",
                        pair.first, pair.second, pair.coefficient));
            }
        }

        List<List<String>> rows = new ArrayList<>();
        for (String row : numeric) {
            List<String> line = new ArrayList<>();
            line.add(row);
            for (String column : numeric) {
                line.add(formatNumber(matrix.get(row).get(column), 6));
            }
            rows.add(line);
        }
        content.append("\nCorrelation matrix:\n").append(TextTable.render(numeric, rows));
        return content.toString();
    }

    private static final class StrongCorrelation {
        private final String first;
        private final String second;
        private final double coefficient;

        private StrongCorrelation(String first, String second, double coefficient) {
            this.first = first;
            this.second = second;
            this.coefficient = coefficient;
        }

        private ContextValue toContextValue() {
            Map<String, ContextValue> entry = new LinkedHashMap<>();
            entry.put("variable_1", ContextValue.of(first));
            entry.put("variable_2", ContextValue.of(second));
            entry.put("coefficient", ContextValue.of(coefficient));
            return ContextValue.of(entry);
        }
    }

    // ---------------------------------------------------------------- helpers

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static Map<String, Long> top(Map<String, Long> counts, int limit) {
        return counts.entrySet().stream()
                .limit(limit)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (a, b) -> a, LinkedHashMap::new));
    }

    private static Map<String, Long> sortByCountDescending(Map<String, Long> counts) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (a, b) -> a, LinkedHashMap::new));
    }

    private static String formatCounts(Map<String, Long> counts) {
        return counts.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static String formatNumber(double value, int decimals) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }
}

package com.statassist.rag.dataset;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory tabular dataset with typed columns.
 * <p>
 * Cells hold {@link Long} for {@link ColumnType#INTEGER}, {@link Double} for
 * {@link ColumnType#DECIMAL}, {@link String} for {@link ColumnType#TEXT}, and null for a
 * missing value. Instances are immutable; {@link #slice(int, int)} returns a new dataset
 * sharing the column layout.
 */
public final class Dataset {

    private final String name;
    private final List<String> columns;
    private final Map<String, ColumnType> types;
    private final Map<String, Integer> positions;
    private final List<Object[]> rows;

    private Dataset(String name, Map<String, ColumnType> types, List<Object[]> rows) {
        this.name = name;
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        this.columns = List.copyOf(types.keySet());
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            index.put(columns.get(i), i);
        }
        this.positions = index;
        this.rows = Collections.unmodifiableList(rows);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<String> columnNames() {
        return columns;
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return positions.containsKey(column);
    }

    public ColumnType columnType(String column) {
        ColumnType type = types.get(column);
        if (type == null) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return type;
    }

    /** Column name to dtype label, in column order. */
    public Map<String, String> dataTypes() {
        return dataTypes(columns);
    }

    public Map<String, String> dataTypes(List<String> subset) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (String column : subset) {
            labels.put(column, columnType(column).getLabel());
        }
        return labels;
    }

    public List<String> numericColumns() {
        return columns.stream()
                .filter(column -> types.get(column).isNumeric())
                .collect(Collectors.toList());
    }

    public List<String> categoricalColumns() {
        return columns.stream()
                .filter(column -> !types.get(column).isNumeric())
                .collect(Collectors.toList());
    }

    /**
     * Rows {@code [from, to)} as a new dataset; bounds are clamped to the row count.
     */
    public Dataset slice(int from, int to) {
        int start = Math.max(0, Math.min(from, rows.size()));
        int end = Math.max(start, Math.min(to, rows.size()));
        return new Dataset(name, types, new ArrayList<>(rows.subList(start, end)));
    }

    public Object value(int row, String column) {
        return rows.get(row)[position(column)];
    }

    public List<Object> values(String column) {
        int position = position(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            values.add(row[position]);
        }
        return values;
    }

    /** Non-missing values of a numeric column. */
    public double[] numericValues(String column) {
        requireNumeric(column);
        int position = position(column);
        return rows.stream()
                .map(row -> row[position])
                .filter(value -> value != null)
                .mapToDouble(value -> ((Number) value).doubleValue())
                .toArray();
    }

    public long missingCount(String column) {
        int position = position(column);
        return rows.stream().filter(row -> row[position] == null).count();
    }

    public long totalMissing() {
        long missing = 0;
        for (String column : columns) {
            missing += missingCount(column);
        }
        return missing;
    }

    /**
     * Occurrences of each distinct non-missing value, most frequent first; ties keep the
     * order of first appearance.
     */
    public Map<String, Long> valueCounts(String column) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object value : values(column)) {
            if (value != null) {
                counts.merge(formatCell(value), 1L, Long::sum);
            }
        }
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));
        Map<String, Long> ordered = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : entries) {
            ordered.put(entry.getKey(), entry.getValue());
        }
        return ordered;
    }

    public int uniqueCount(String column) {
        return valueCounts(column).size();
    }

    /** Most frequent non-missing value, empty when the column has none. */
    public Optional<String> mode(String column) {
        return valueCounts(column).keySet().stream().findFirst();
    }

    public ColumnSummary summary(String column) {
        double[] values = numericValues(column);
        if (values.length == 0) {
            return new ColumnSummary(0, Double.NaN, Double.NaN, Double.NaN,
                    Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        stats.setPercentileImpl(new Percentile().withEstimationType(Percentile.EstimationType.R_7));
        double std = values.length > 1 ? stats.getStandardDeviation() : Double.NaN;
        return new ColumnSummary(
                values.length,
                stats.getMean(),
                std,
                stats.getMin(),
                stats.getPercentile(25),
                stats.getPercentile(50),
                stats.getPercentile(75),
                stats.getMax());
    }

    /**
     * Pearson correlation over rows where both columns are present; NaN when fewer than two
     * such rows exist or either side is constant.
     */
    public double correlation(String first, String second) {
        requireNumeric(first);
        requireNumeric(second);
        int a = position(first);
        int b = position(second);
        List<double[]> pairs = new ArrayList<>();
        for (Object[] row : rows) {
            if (row[a] != null && row[b] != null) {
                pairs.add(new double[]{((Number) row[a]).doubleValue(), ((Number) row[b]).doubleValue()});
            }
        }
        if (pairs.size() < 2) {
            return Double.NaN;
        }
        double[] x = new double[pairs.size()];
        double[] y = new double[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            x[i] = pairs.get(i)[0];
            y[i] = pairs.get(i)[1];
        }
        return new PearsonsCorrelation().correlation(x, y);
    }

    /** Full pairwise matrix over the given numeric columns, in the given order. */
    public Map<String, Map<String, Double>> correlationMatrix(List<String> numericColumns) {
        Map<String, Map<String, Double>> matrix = new LinkedHashMap<>();
        for (String row : numericColumns) {
            Map<String, Double> line = new LinkedHashMap<>();
            for (String column : numericColumns) {
                line.put(column, row.equals(column) ? selfCorrelation(row) : correlation(row, column));
            }
            matrix.put(row, line);
        }
        return matrix;
    }

    /** Cell rendered for chunk text; missing cells read "NaN". */
    public static String formatCell(Object value) {
        if (value == null) {
            return "NaN";
        }
        if (value instanceof Double) {
            double number = (Double) value;
            if (number == Math.rint(number) && !Double.isInfinite(number)) {
                return String.format(Locale.ROOT, "%.1f", number);
            }
            return String.valueOf(number);
        }
        return value.toString();
    }

    private double selfCorrelation(String column) {
        ColumnSummary summary = summary(column);
        return summary.getCount() > 1 && summary.getStd() > 0 ? 1.0 : Double.NaN;
    }

    private int position(String column) {
        Integer position = positions.get(column);
        if (position == null) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return position;
    }

    private void requireNumeric(String column) {
        if (!columnType(column).isNumeric()) {
            throw new IllegalArgumentException("Column '" + column + "' is not numeric");
        }
    }

    /**
     * Accumulates columns then rows; values are coerced to each column's storage type.
     */
    public static final class Builder {

        private final String name;
        private final Map<String, ColumnType> types = new LinkedHashMap<>();
        private final List<Object[]> rows = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder column(String column, ColumnType type) {
            if (!rows.isEmpty()) {
                throw new IllegalStateException("Columns must be declared before rows");
            }
            if (types.putIfAbsent(column, type) != null) {
                throw new IllegalArgumentException("Duplicate column: " + column);
            }
            return this;
        }

        public Builder row(Object... values) {
            if (values.length != types.size()) {
                throw new IllegalArgumentException("Row has " + values.length
                        + " values but dataset has " + types.size() + " columns");
            }
            Object[] row = new Object[values.length];
            int i = 0;
            for (ColumnType type : types.values()) {
                row[i] = coerce(values[i], type);
                i++;
            }
            rows.add(row);
            return this;
        }

        public Dataset build() {
            return new Dataset(name, types, new ArrayList<>(rows));
        }

        private static Object coerce(Object value, ColumnType type) {
            if (value == null) {
                return null;
            }
            switch (type) {
                case INTEGER:
                    if (value instanceof Number) {
                        return ((Number) value).longValue();
                    }
                    return Long.parseLong(value.toString().trim());
                case DECIMAL:
                    if (value instanceof Number) {
                        double number = ((Number) value).doubleValue();
                        return Double.isNaN(number) ? null : number;
                    }
                    double parsed = Double.parseDouble(value.toString().trim());
                    return Double.isNaN(parsed) ? null : parsed;
                default:
                    return value.toString();
            }
        }
    }
}

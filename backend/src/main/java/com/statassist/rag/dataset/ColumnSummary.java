package com.statassist.rag.dataset;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive statistics of one numeric column, over its non-missing values.
 * Quartiles use linear interpolation between order statistics.
 */
@Value
public class ColumnSummary {

    long count;
    double mean;
    double std;
    double min;
    double q1;
    double median;
    double q3;
    double max;

    /**
     * Statistics keyed the way a describe() table labels its rows.
     */
    public Map<String, Double> asDescribeRows() {
        Map<String, Double> rows = new LinkedHashMap<>();
        rows.put("count", (double) count);
        rows.put("mean", mean);
        rows.put("std", std);
        rows.put("min", min);
        rows.put("25%", q1);
        rows.put("50%", median);
        rows.put("75%", q3);
        rows.put("max", max);
        return rows;
    }
}

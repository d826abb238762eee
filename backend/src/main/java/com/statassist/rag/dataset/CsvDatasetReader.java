package com.statassist.rag.dataset;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.statassist.rag.exception.InvalidDatasetException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads CSV text (header row first) into a typed {@link Dataset}.
 * <p>
 * Column types are inferred from the non-blank cells: all integers → int64, all numbers →
 * float64, anything else → object. An integer column with missing cells is widened to
 * float64. Blank cells become missing values.
 */
@Component
@Slf4j
public class CsvDatasetReader {

    private final CsvMapper csvMapper;

    public CsvDatasetReader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    }

    public Dataset read(String name, InputStream input) {
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            return read(name, reader);
        } catch (IOException e) {
            throw new InvalidDatasetException("Invalid CSV file: " + e.getMessage(), e);
        }
    }

    public Dataset read(String name, Reader reader) {
        List<String[]> records;
        try (MappingIterator<String[]> iterator = csvMapper.readerFor(String[].class)
                .with(CsvSchema.emptySchema())
                .readValues(reader)) {
            records = iterator.readAll();
        } catch (IOException | RuntimeException e) {
            throw new InvalidDatasetException("Invalid CSV file: " + e.getMessage(), e);
        }

        if (records.isEmpty()) {
            throw new InvalidDatasetException("CSV file is empty");
        }

        List<String> header = headerNames(records.get(0));
        List<String[]> body = records.subList(1, records.size());

        List<ColumnType> types = new ArrayList<>(header.size());
        for (int column = 0; column < header.size(); column++) {
            types.add(inferType(body, column));
        }

        Dataset.Builder builder = Dataset.builder(name);
        for (int column = 0; column < header.size(); column++) {
            builder.column(header.get(column), types.get(column));
        }
        for (String[] record : body) {
            if (isBlankRecord(record)) {
                continue;
            }
            Object[] row = new Object[header.size()];
            for (int column = 0; column < header.size(); column++) {
                row[column] = cell(record, column);
            }
            builder.row(row);
        }

        Dataset dataset = builder.build();
        log.info("Parsed dataset '{}': {} rows, {} columns {}", name,
                dataset.rowCount(), dataset.columnCount(), dataset.dataTypes());
        return dataset;
    }

    private List<String> headerNames(String[] raw) {
        List<String> names = new ArrayList<>(raw.length);
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < raw.length; i++) {
            String candidate = raw[i] == null || raw[i].isBlank() ? "Unnamed: " + i : raw[i].trim();
            int occurrences = seen.merge(candidate, 1, Integer::sum);
            names.add(occurrences == 1 ? candidate : candidate + "." + (occurrences - 1));
        }
        return names;
    }

    private ColumnType inferType(List<String[]> body, int column) {
        boolean sawValue = false;
        boolean sawMissing = false;
        boolean allIntegers = true;
        boolean allNumbers = true;

        for (String[] record : body) {
            if (isBlankRecord(record)) {
                continue;
            }
            String cell = cell(record, column);
            if (cell == null) {
                sawMissing = true;
                continue;
            }
            sawValue = true;
            if (allIntegers && !isInteger(cell)) {
                allIntegers = false;
            }
            if (allNumbers && !isNumber(cell)) {
                allNumbers = false;
                break;
            }
        }

        if (!sawValue || !allNumbers) {
            return ColumnType.TEXT;
        }
        if (allIntegers && !sawMissing) {
            return ColumnType.INTEGER;
        }
        return ColumnType.DECIMAL;
    }

    private static String cell(String[] record, int column) {
        if (column >= record.length || record[column] == null) {
            return null;
        }
        String value = record[column].trim();
        return value.isEmpty() ? null : value;
    }

    private static boolean isBlankRecord(String[] record) {
        for (String value : record) {
            if (value != null && !value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private static boolean isInteger(String value) {
        try {
            Long.parseLong(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isNumber(String value) {
        try {
            double parsed = Double.parseDouble(value);
            return !Double.isInfinite(parsed);
        } catch (NumberFormatException e) {
            return false;
        }
    }
}

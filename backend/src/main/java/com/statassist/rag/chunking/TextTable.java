package com.statassist.rag.chunking;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a small right-aligned text table (first column is the row label) for chunk text.
 */
final class TextTable {

    private static final String SEPARATOR = "  ";

    private TextTable() {
    }

    static String render(List<String> header, List<List<String>> rows) {
        List<List<String>> lines = new ArrayList<>();
        List<String> headerLine = new ArrayList<>();
        headerLine.add("");
        headerLine.addAll(header);
        lines.add(headerLine);
        lines.addAll(rows);

        int columns = headerLine.size();
        int[] widths = new int[columns];
        for (List<String> line : lines) {
            for (int i = 0; i < columns && i < line.size(); i++) {
                widths[i] = Math.max(widths[i], line.get(i).length());
            }
        }

        StringBuilder text = new StringBuilder();
        for (int l = 0; l < lines.size(); l++) {
            List<String> line = lines.get(l);
            StringBuilder rendered = new StringBuilder();
            for (int i = 0; i < columns; i++) {
                String cell = i < line.size() ? line.get(i) : "";
                if (i > 0) {
                    rendered.append(SEPARATOR);
                }
                // row labels are left-aligned, values right-aligned
                rendered.append(i == 0 ? padRight(cell, widths[i]) : padLeft(cell, widths[i]));
            }
            text.append(rendered.toString().stripTrailing());
            if (l < lines.size() - 1) {
                text.append('\n');
            }
        }
        return text.toString();
    }

    private static String padLeft(String value, int width) {
        return " ".repeat(Math.max(0, width - value.length())) + value;
    }

    private static String padRight(String value, int width) {
        return value + " ".repeat(Math.max(0, width - value.length()));
    }
}

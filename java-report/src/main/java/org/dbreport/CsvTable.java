package org.dbreport;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal in-memory CSV table with a header row.
 * 
 * <p>Handles the subset of RFC 4180 that Locust emits: comma separators, quoted
 * fields with embedded commas or line breaks, and doubled quotes inside quoted
 * fields. Blank lines are skipped. Rows shorter than the header are padded with
 * empty cells.
 * 
 * <p>Numeric access never throws: cells that are blank or not a number
 * (Locust writes {@code N/A} for empty percentiles) read as {@link Double#NaN}.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public final class CsvTable {
    private final List<String> header;
    private final Map<String, Integer> columnIndex;
    private final List<String[]> rows;

    CsvTable(List<String> header, List<String[]> rows) {
        this.header = Collections.unmodifiableList(new ArrayList<>(header));
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            index.putIfAbsent(header.get(i), i);
        }
        this.columnIndex = index;
        this.rows = rows;
    }

    /**
     * Reads a CSV file whose first record is the header.
     * 
     * @param file The file to read
     * @return The parsed table; a file with no records yields an empty table with no columns
     * @throws IOException If the file cannot be read
     */
    public static CsvTable read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    static CsvTable parse(BufferedReader reader) throws IOException {
        List<List<String>> records = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean fieldStarted = false;
        int c;
        while ((c = reader.read()) != -1) {
            char ch = (char) c;
            if (inQuotes) {
                if (ch == '"') {
                    reader.mark(1);
                    int next = reader.read();
                    if (next == '"') {
                        field.append('"');
                    } else {
                        inQuotes = false;
                        if (next != -1) {
                            reader.reset();
                        }
                    }
                } else {
                    field.append(ch);
                }
                continue;
            }
            switch (ch) {
                case '"':
                    inQuotes = true;
                    fieldStarted = true;
                    break;
                case ',':
                    current.add(field.toString());
                    field.setLength(0);
                    fieldStarted = true;
                    break;
                case '\r':
                    break;
                case '\n':
                    endRecord(records, current, field, fieldStarted);
                    current = new ArrayList<>();
                    fieldStarted = false;
                    break;
                default:
                    field.append(ch);
                    fieldStarted = true;
            }
        }
        endRecord(records, current, field, fieldStarted);

        if (records.isEmpty()) {
            return new CsvTable(new ArrayList<>(), new ArrayList<>());
        }
        List<String> header = new ArrayList<>();
        for (String name : records.get(0)) {
            header.add(name.trim());
        }
        List<String[]> rows = new ArrayList<>(records.size() - 1);
        for (int i = 1; i < records.size(); i++) {
            List<String> record = records.get(i);
            String[] row = new String[header.size()];
            for (int col = 0; col < row.length; col++) {
                row[col] = col < record.size() ? record.get(col) : "";
            }
            rows.add(row);
        }
        return new CsvTable(header, rows);
    }

    private static void endRecord(List<List<String>> records, List<String> current,
                                  StringBuilder field, boolean fieldStarted) {
        if (fieldStarted || field.length() > 0 || !current.isEmpty()) {
            current.add(field.toString());
            records.add(current);
        }
        field.setLength(0);
    }

    public List<String> getHeader() {
        return header;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columnIndex.containsKey(column);
    }

    /**
     * Gets a cell as text.
     * 
     * @param row Zero-based data row index (the header is not a row)
     * @param column Column name
     * @return The raw cell text, or {@code null} if the column does not exist
     */
    public String get(int row, String column) {
        Integer col = columnIndex.get(column);
        if (col == null) {
            return null;
        }
        return rows.get(row)[col];
    }

    /**
     * Gets a cell as a number.
     * 
     * @param row Zero-based data row index
     * @param column Column name
     * @return The parsed value, or {@code NaN} if the column is missing or the cell is not numeric
     */
    public double getDouble(int row, String column) {
        return parseNumber(get(row, column));
    }

    /**
     * Gets every value of a numeric column, in row order.
     * 
     * @param column Column name
     * @return One value per row, {@code NaN} for non-numeric cells; empty if the column is missing
     */
    public double[] column(String column) {
        if (!hasColumn(column)) {
            return new double[0];
        }
        double[] values = new double[rows.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = getDouble(i, column);
        }
        return values;
    }

    static double parseNumber(String raw) {
        if (raw == null) {
            return Double.NaN;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}

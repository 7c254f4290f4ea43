package com.marketruns.common.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An already-materialized input table: a header row plus string cells.
 *
 * <p>Blank cells read as {@code null}. Rows shorter than the header are padded with
 * {@code null}. The table is never modified after construction.
 */
public final class DataTable {

    /** Column index returned for a header the table does not have. */
    public static final int ABSENT = -1;

    private final String source;
    private final List<String> headers;
    private final Map<String, Integer> index;
    private final List<String[]> rows;

    private DataTable(String source, List<String> headers, List<String[]> rows) {
        this.source  = source;
        this.headers = List.copyOf(headers);
        this.rows    = Collections.unmodifiableList(rows);
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < this.headers.size(); i++) {
            idx.putIfAbsent(this.headers.get(i), i);
        }
        this.index = Collections.unmodifiableMap(idx);
    }

    /**
     * @param source  name used in log lines and error messages (usually the file path)
     * @param headers column names in file order
     * @param rows    cell values per row; copied
     */
    public static DataTable of(String source, List<String> headers, List<? extends List<String>> rows) {
        List<String[]> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            String[] cells = new String[headers.size()];
            for (int c = 0; c < cells.length && c < row.size(); c++) {
                cells[c] = normalize(row.get(c));
            }
            copy.add(cells);
        }
        return new DataTable(source, headers, copy);
    }

    public String source() {
        return source;
    }

    public List<String> headers() {
        return headers;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return headers.size();
    }

    public boolean hasColumn(String header) {
        return index.containsKey(header);
    }

    /** Index of the header, or {@link #ABSENT}. */
    public int columnIndex(String header) {
        Integer i = index.get(header);
        return i != null ? i : ABSENT;
    }

    /** Cell value, or {@code null} when blank or when {@code column} is {@link #ABSENT}. */
    public String cell(int row, int column) {
        if (column < 0) {
            return null;
        }
        return rows.get(row)[column];
    }

    public String cell(int row, String header) {
        return cell(row, columnIndex(header));
    }

    private static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public String toString() {
        return "DataTable '" + source + "' (" + rowCount() + " rows, " + columnCount() + " columns)";
    }
}

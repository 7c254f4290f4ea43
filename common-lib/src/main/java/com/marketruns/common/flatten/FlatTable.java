package com.marketruns.common.flatten;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows of a flattened experiment. Every row has exactly the keys of {@code columns}, in
 * that order; absent values are {@code null}.
 */
public record FlatTable(FlattenLevel level, List<String> columns, List<Map<String, Object>> rows) {

    public FlatTable {
        columns = List.copyOf(columns);
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** Values of one column, top to bottom. */
    public List<Object> column(String name) {
        if (!columns.contains(name)) {
            throw new IllegalArgumentException("no such column: " + name);
        }
        List<Object> values = new ArrayList<>(rows.size());
        rows.forEach(r -> values.add(r.get(name)));
        return values;
    }

    @Override
    public String toString() {
        return "FlatTable " + level + " (" + rows.size() + " rows, " + columns.size() + " columns)";
    }
}

package com.skanga.mysqlmcp.db;

import java.util.List;
import java.util.Map;

/**
 * Rows produced by one statement.
 *
 * @param fields column labels in result order
 * @param rows   one map per row, keyed by column label, in result order
 */
public record QueryRows(List<String> fields, List<Map<String, Object>> rows) {
    public static final String AFFECTED_ROWS = "affected_rows";

    public QueryRows {
        fields = List.copyOf(fields);
        rows = List.copyOf(rows);
    }

    public static QueryRows affectedRows(int count) {
        return new QueryRows(List.of(AFFECTED_ROWS), List.of(Map.of(AFFECTED_ROWS, count)));
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int rowCount() {
        return rows.size();
    }
}

package com.example.discrepancy.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Immutable in-memory table read from a procurement report.
 * Columns keep header order, rows keep sheet order; every operation returns a new table.
 */
public record ReportTable(List<String> columns, List<ReportRow> rows) {

    public ReportTable {
        if (new LinkedHashSet<>(columns).size() != columns.size()) {
            throw new IllegalArgumentException("Column names must be unique: " + columns);
        }
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

	/**
	 * Builds a table from positional cell lists, one list per row aligned with {@code columns}.
	 * Short rows are padded with missing cells.
	 *
	 * @param columns header names
	 * @param cells   row values in column order, {@code null} for missing cells
	 * @return populated table
	 */
    public static ReportTable fromCells(List<String> columns, List<? extends List<?>> cells) {
        List<ReportRow> rows = new ArrayList<>(cells.size());
        for (List<?> rowCells : cells) {
            if (rowCells.size() > columns.size()) {
                throw new IllegalArgumentException("Row has more cells than the header: " + rowCells);
            }
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                values.put(columns.get(i), i < rowCells.size() ? rowCells.get(i) : null);
            }
            rows.add(new ReportRow(values));
        }
        return new ReportTable(columns, rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

	/**
	 * Collects every value of a single column in row order.
	 *
	 * @param column column name
	 * @return values, {@code null} entries for missing cells
	 */
    public List<Object> columnValues(String column) {
        requireColumn(column);
        List<Object> values = new ArrayList<>(rows.size());
        rows.forEach(row -> values.add(row.get(column)));
        return values;
    }

	/**
	 * Replaces every value of one column with the result of {@code mapper}.
	 *
	 * @param column column to rewrite
	 * @param mapper cell transformation, receives {@code null} for missing cells
	 * @return new table with the rewritten column
	 */
    public ReportTable mapColumn(String column, UnaryOperator<Object> mapper) {
        requireColumn(column);
        List<ReportRow> mapped = new ArrayList<>(rows.size());
        for (ReportRow row : rows) {
            Map<String, Object> values = new LinkedHashMap<>(row.values());
            values.put(column, mapper.apply(row.get(column)));
            mapped.add(new ReportRow(values));
        }
        return new ReportTable(columns, mapped);
    }

	/**
	 * Keeps the rows matching {@code predicate}, preserving their order.
	 *
	 * @param predicate row filter
	 * @return new table containing the matching rows only
	 */
    public ReportTable filter(Predicate<ReportRow> predicate) {
        return new ReportTable(columns, rows.stream().filter(predicate).toList());
    }

	/**
	 * Computes a column from each row. The column is appended after the existing ones,
	 * or rewritten in place when the header already has it.
	 *
	 * @param column  name of the computed column
	 * @param compute value supplier evaluated once per row
	 * @return new table containing the computed column
	 */
    public ReportTable withColumn(String column, Function<ReportRow, Object> compute) {
        List<String> extended = new ArrayList<>(columns);
        if (!hasColumn(column)) {
            extended.add(column);
        }
        List<ReportRow> computed = new ArrayList<>(rows.size());
        for (ReportRow row : rows) {
            Map<String, Object> values = new LinkedHashMap<>(row.values());
            values.put(column, compute.apply(row));
            computed.add(new ReportRow(values));
        }
        return new ReportTable(extended, computed);
    }

    private void requireColumn(String column) {
        if (!hasColumn(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
    }
}

package com.example.discrepancy.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Domain DTO describing one data row of a procurement report.
 * Cells are keyed by column name in header order; a {@code null} value marks a missing cell.
 */
public record ReportRow(Map<String, Object> values) {

    public ReportRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

	/**
	 * Returns the raw cell value for a column.
	 *
	 * @param column column name as it appears in the header
	 * @return cell value or {@code null} when the cell is missing
	 */
    public Object get(String column) {
        return values.get(column);
    }

	/**
	 * Reads a cell that the pipeline has already coerced to a number.
	 *
	 * @param column numeric column name
	 * @return numeric value, {@link Double#NaN} when the cell is not a number
	 */
    public double number(String column) {
        return values.get(column) instanceof Number number ? number.doubleValue() : Double.NaN;
    }
}

package com.example.discrepancy.application.service;

import com.example.discrepancy.domain.exception.EmptyReportException;
import com.example.discrepancy.domain.exception.MissingColumnsException;
import com.example.discrepancy.domain.model.ReportTable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Checks that a report has data and carries every column the pipeline needs.
 */
@Service
public class ReportSchemaValidator {

	/**
	 * Validates the table shape without modifying it.
	 *
	 * @param table           parsed report
	 * @param requiredColumns column names that must be present
	 * @throws EmptyReportException    when the table has no rows
	 * @throws MissingColumnsException when at least one required column is absent; lists all of them
	 */
    public void validate(ReportTable table, List<String> requiredColumns) {
        if (table.isEmpty()) {
            throw new EmptyReportException();
        }
        List<String> missing = requiredColumns.stream()
                .filter(column -> !table.hasColumn(column))
                .toList();
        if (!missing.isEmpty()) {
            throw new MissingColumnsException(missing);
        }
    }
}

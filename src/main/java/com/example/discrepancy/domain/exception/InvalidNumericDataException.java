package com.example.discrepancy.domain.exception;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raised when a quantity cell is still not a number after normalization.
 * A single bad cell rejects the whole report; rows are never skipped silently.
 */
public class InvalidNumericDataException extends DomainException {

    private final List<Integer> rowNumbers;

	/**
	 * Creates the exception for the given data rows.
	 *
	 * @param rowNumbers 1-based data row numbers holding invalid quantities (may be truncated by the caller)
	 */
    public InvalidNumericDataException(List<Integer> rowNumbers) {
        super("Numeric columns contain invalid data in rows: " + rowNumbers.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ")));
        this.rowNumbers = List.copyOf(rowNumbers);
    }

    public List<Integer> rowNumbers() {
        return rowNumbers;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("rows", rowNumbers);
    }
}

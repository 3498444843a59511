package com.example.discrepancy.domain.exception;

import java.util.List;
import java.util.Map;

/**
 * Raised when one or more required columns are absent from the report header.
 * Carries every missing column, not only the first one found.
 */
public class MissingColumnsException extends DomainException {

    private final List<String> missingColumns;

	/**
	 * Creates the exception and lists the missing columns in the message.
	 *
	 * @param missingColumns names of the absent required columns, in required order
	 */
    public MissingColumnsException(List<String> missingColumns) {
        super("Missing required columns: " + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> missingColumns() {
        return missingColumns;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("missingColumns", missingColumns);
    }
}

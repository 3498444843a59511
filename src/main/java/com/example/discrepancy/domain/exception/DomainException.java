package com.example.discrepancy.domain.exception;

import java.util.Map;

/**
 * Base type for all domain-level exceptions in the report model.
 * Subclasses capture rule violations of a procurement report without leaking infrastructure dependencies.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which rule broke
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * Creates a domain exception that wraps an underlying cause.
	 *
	 * @param message explanation of which rule broke
	 * @param cause   original exception that triggered the domain failure
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }

	/**
	 * Structured context that the API layer may expose next to the message.
	 *
	 * @return immutable map of detail attributes, empty by default
	 */
    public Map<String, Object> details() {
        return Map.of();
    }
}

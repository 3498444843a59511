package com.example.discrepancy.domain.exception;

/**
 * Raised when the client attempts to submit a report without providing a file.
 * This is a domain-layer guard that protects downstream parsing logic from null inputs.
 */
public class ReportFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public ReportFileRequiredException() {
        super("Please choose an .xlsx report to upload.");
    }
}

package com.example.discrepancy.domain.exception;

/**
 * Raised when an uploaded report has no data rows below its header.
 */
public class EmptyReportException extends DomainException {

	/**
	 * Creates the exception with a predefined error message.
	 */
    public EmptyReportException() {
        super("The report is empty.");
    }
}

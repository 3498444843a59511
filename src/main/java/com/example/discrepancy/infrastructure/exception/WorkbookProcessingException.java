package com.example.discrepancy.infrastructure.exception;

import java.nio.file.Path;

/**
 * Infrastructure-layer exception that signals issues while opening or writing a workbook.
 */
public class WorkbookProcessingException extends InfrastructureException {

	/**
	 * Creates the exception for a workbook read from or written to a stream.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level POI or IO exception
	 */
    public WorkbookProcessingException(String message, Throwable cause) {
        super(message, null, cause);
    }

	/**
	 * Creates the exception for a workbook stored on disk.
	 *
	 * @param message  description shared with the application layer
	 * @param location workbook file
	 * @param cause    low-level POI or IO exception
	 */
    public WorkbookProcessingException(String message, Path location, Throwable cause) {
        super(message, location, cause);
    }
}

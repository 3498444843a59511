package com.example.discrepancy.domain.exception;

import java.util.Map;

/**
 * Raised when the uploaded file is not an {@code .xlsx} workbook according to the domain rules.
 * This protects the pipeline from receiving unsupported formats.
 */
public class UnsupportedReportFormatException extends DomainException {

    private final String fileName;

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 * @param reason   what made the file unacceptable
	 */
    public UnsupportedReportFormatException(String fileName, String reason) {
        super(reason + (fileName != null ? ": " + fileName : "."));
        this.fileName = fileName;
    }

	/**
	 * Variant used when the file content could not be opened as a workbook.
	 *
	 * @param fileName original file name supplied by the client
	 * @param reason   what made the file unacceptable
	 * @param cause    reader failure
	 */
    public UnsupportedReportFormatException(String fileName, String reason, Throwable cause) {
        super(reason + (fileName != null ? ": " + fileName : "."), cause);
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }

    @Override
    public Map<String, Object> details() {
        return fileName != null ? Map.of("fileName", fileName) : Map.of();
    }
}

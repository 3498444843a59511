package com.example.discrepancy.infrastructure.exception;

import java.nio.file.Path;

/**
 * Raised when the temporary report directory cannot be written to or read from.
 */
public class ReportStorageException extends InfrastructureException {

    public ReportStorageException(String message, Path location, Throwable cause) {
        super(message, location, cause);
    }
}

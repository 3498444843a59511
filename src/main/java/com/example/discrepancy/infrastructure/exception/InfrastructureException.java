package com.example.discrepancy.infrastructure.exception;

import java.nio.file.Path;

/**
 * Base unchecked exception for workbook and temporary storage failures.
 * Records the file involved, if any, for logging; it is never exposed to API clients.
 */
public abstract class InfrastructureException extends RuntimeException {

    private final Path location;

	/**
	 * Creates a new infrastructure exception while preserving the root cause.
	 *
	 * @param message  context about the failure
	 * @param location file or directory being accessed, {@code null} for in-memory streams
	 * @param cause    exception bubbling up from POI or the file system
	 */
    protected InfrastructureException(String message, Path location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public Path location() {
        return location;
    }
}

package com.example.discrepancy.application.exception;

/**
 * Base unchecked exception for use-case failures tied to one report task.
 * The task id travels with the exception so the API layer can echo it back to the caller.
 */
public abstract class ApplicationException extends RuntimeException {

    private final String taskId;

	/**
	 * Creates a new application-layer exception for a task.
	 *
	 * @param taskId  id of the affected task, {@code null} when no task was created yet
	 * @param message human readable error description suitable for surfacing to the caller
	 * @param cause   underlying exception coming from deeper layers, may be {@code null}
	 */
    protected ApplicationException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}

package com.example.discrepancy.application.exception;

/**
 * Signals that the report worker pool refused a new task because it is saturated.
 * Controllers translate this into HTTP 503 so the client can retry later.
 */
public class ReportQueueFullException extends ApplicationException {

	/**
	 * Creates the exception wrapping the executor rejection.
	 *
	 * @param taskId id of the task that could not be scheduled
	 * @param cause  rejection raised by the executor
	 */
    public ReportQueueFullException(String taskId, Throwable cause) {
        super(taskId, "The report queue is full, task " + taskId + " was not started. Please retry later.", cause);
    }
}

package com.example.discrepancy.domain.exception;

import java.util.Map;

/**
 * Raised when a task id is unknown to the registry, either never issued or already evicted.
 */
public class TaskNotFoundException extends DomainException {

    private final String taskId;

	/**
	 * Creates the exception and records the unknown task id.
	 *
	 * @param taskId handle supplied by the client
	 */
    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("taskId", taskId);
    }
}

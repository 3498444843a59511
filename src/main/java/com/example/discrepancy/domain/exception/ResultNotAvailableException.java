package com.example.discrepancy.domain.exception;

import java.util.Map;

/**
 * Raised when a result is requested for a task that has not succeeded or whose output was already purged.
 */
public class ResultNotAvailableException extends DomainException {

    private final String taskId;

    public ResultNotAvailableException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("taskId", taskId);
    }
}

package com.example.discrepancy.interfaces.api;

import com.example.discrepancy.domain.model.ReportTask;
import com.example.discrepancy.domain.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * API-layer DTO describing the state of a submitted report. {@code error} is {@code null} unless the task failed.
 */
public record TaskStatusResponse(
        @JsonProperty("task_id") String taskId,
        TaskStatus status,
        String error
) {

    public static TaskStatusResponse from(ReportTask task) {
        return new TaskStatusResponse(task.taskId(), task.status(), task.error());
    }
}

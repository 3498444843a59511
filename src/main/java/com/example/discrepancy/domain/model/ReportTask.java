package com.example.discrepancy.domain.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Domain DTO tracking one submitted report from upload to download.
 *
 * @param taskId      opaque handle returned to the client
 * @param status      current lifecycle state
 * @param error       failure reason, only set for {@link TaskStatus#FAILED}
 * @param outputPath  where the result workbook is written on success
 * @param submittedAt time the task was registered
 * @param finishedAt  time the task left {@link TaskStatus#PENDING}, {@code null} while pending
 */
public record ReportTask(
        String taskId,
        TaskStatus status,
        String error,
        Path outputPath,
        Instant submittedAt,
        Instant finishedAt
) {

    public static ReportTask pending(String taskId, Path outputPath, Instant submittedAt) {
        return new ReportTask(taskId, TaskStatus.PENDING, null, outputPath, submittedAt, null);
    }

    public ReportTask succeeded(Instant at) {
        return new ReportTask(taskId, TaskStatus.SUCCESS, null, outputPath, submittedAt, at);
    }

    public ReportTask failed(String reason, Instant at) {
        return new ReportTask(taskId, TaskStatus.FAILED, reason, outputPath, submittedAt, at);
    }
}

package com.example.discrepancy.application.service;

import com.example.discrepancy.application.exception.ApplicationException;
import com.example.discrepancy.application.exception.ReportQueueFullException;
import com.example.discrepancy.domain.exception.DomainException;
import com.example.discrepancy.domain.exception.ReportFileRequiredException;
import com.example.discrepancy.domain.exception.ResultNotAvailableException;
import com.example.discrepancy.domain.exception.TaskNotFoundException;
import com.example.discrepancy.domain.exception.UnsupportedReportFormatException;
import com.example.discrepancy.domain.model.ReportTable;
import com.example.discrepancy.domain.model.ReportTask;
import com.example.discrepancy.domain.model.TaskStatus;
import com.example.discrepancy.infrastructure.config.DiscrepancyConfig;
import com.example.discrepancy.infrastructure.exception.InfrastructureException;
import com.example.discrepancy.infrastructure.exception.ReportStorageException;
import com.example.discrepancy.infrastructure.exception.WorkbookProcessingException;
import com.example.discrepancy.infrastructure.storage.ReportFileStore;
import com.example.discrepancy.infrastructure.xlsx.XlsxReportReader;
import com.example.discrepancy.infrastructure.xlsx.XlsxReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

/**
 * Application-layer service behind the upload, poll and download workflow.
 * It validates and stores uploads, runs one {@link DiscrepancyPipeline} per report on the worker pool,
 * and records the outcome against the task id.
 */
@Service
public class ReportTaskService {

    private static final Logger log = LoggerFactory.getLogger(ReportTaskService.class);
    private static final String XLSX_EXTENSION = ".xlsx";
    private static final String FAILURE_PREFIX = "Report processing failed: ";
    private static final String STORAGE_FAILURE = "the report file could not be read or written.";
    private static final String INTERNAL_FAILURE = "internal error.";

    private final ReportFileStore fileStore;
    private final XlsxReportReader reportReader;
    private final XlsxReportWriter reportWriter;
    private final DiscrepancyPipeline pipeline;
    private final ReportTaskRegistry taskRegistry;
    private final TaskExecutor taskExecutor;

	/**
	 * Creates the service with its storage, workbook and execution collaborators.
	 *
	 * @param fileStore    transient storage for inputs and outputs
	 * @param reportReader workbook reader
	 * @param reportWriter workbook writer
	 * @param pipeline     discrepancy computation
	 * @param taskRegistry task state registry
	 * @param taskExecutor worker pool running the pipelines
	 */
    public ReportTaskService(ReportFileStore fileStore,
                             XlsxReportReader reportReader,
                             XlsxReportWriter reportWriter,
                             DiscrepancyPipeline pipeline,
                             ReportTaskRegistry taskRegistry,
                             @Qualifier(DiscrepancyConfig.REPORT_TASK_EXECUTOR) TaskExecutor taskExecutor) {
        this.fileStore = fileStore;
        this.reportReader = reportReader;
        this.reportWriter = reportWriter;
        this.pipeline = pipeline;
        this.taskRegistry = taskRegistry;
        this.taskExecutor = taskExecutor;
    }

	/**
	 * Accepts an uploaded report and schedules its processing.
	 *
	 * @param file uploaded workbook
	 * @return the pending task
	 * @throws ReportFileRequiredException       when the file is null or empty
	 * @throws UnsupportedReportFormatException  when the name is not {@code .xlsx} or the bytes are not a workbook
	 * @throws ReportQueueFullException          when the worker pool rejects the task
	 */
    public ReportTask submit(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ReportFileRequiredException();
        }
        String fileName = file.getOriginalFilename();
        if (fileName == null || !fileName.toLowerCase(Locale.ROOT).endsWith(XLSX_EXTENSION)) {
            throw new UnsupportedReportFormatException(fileName, "Only .xlsx reports are supported");
        }

        String taskId = UUID.randomUUID().toString();
        Path input = storeInput(taskId, file);
        try {
            reportReader.read(input);
        } catch (WorkbookProcessingException ex) {
            fileStore.delete(input);
            throw new UnsupportedReportFormatException(fileName, "The file is not a readable .xlsx workbook", ex);
        }

        ReportTask task = taskRegistry.register(taskId, fileStore.outputPath(taskId));
        try {
            taskExecutor.execute(() -> process(taskId, input));
        } catch (RejectedExecutionException ex) {
            log.warn("Report task {} rejected by the worker pool", taskId);
            fileStore.delete(input);
            taskRegistry.markFailed(taskId, "The report queue is full.");
            throw new ReportQueueFullException(taskId, ex);
        }
        log.info("Report task {} submitted for file {}", taskId, fileName);
        return task;
    }

	/**
	 * Looks up the current state of a task.
	 *
	 * @param taskId handle returned by {@link #submit(MultipartFile)}
	 * @return task state
	 * @throws TaskNotFoundException when the id is unknown
	 */
    public ReportTask status(String taskId) {
        return taskRegistry.find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

	/**
	 * Resolves the result workbook of a successful task.
	 *
	 * @param taskId handle returned by {@link #submit(MultipartFile)}
	 * @return path of the result workbook
	 * @throws TaskNotFoundException        when the id is unknown
	 * @throws ResultNotAvailableException  when the task is not successful or its output was purged
	 */
    public Path result(String taskId) {
        ReportTask task = status(taskId);
        if (task.status() != TaskStatus.SUCCESS) {
            throw new ResultNotAvailableException(taskId, "Task is not finished or has failed: " + taskId);
        }
        if (!Files.isRegularFile(task.outputPath())) {
            throw new ResultNotAvailableException(taskId, "Result is no longer available: " + taskId);
        }
        return task.outputPath();
    }

    /**
     * Runs one report to completion on a worker thread. Failures are recorded, never rethrown,
     * except for {@link Error}s which are rethrown once the task is marked failed.
     */
    void process(String taskId, Path input) {
        String failure = null;
        Error fatal = null;
        try {
            ReportTable report = reportReader.read(input);
            ReportTable flagged = pipeline.run(report);
            fileStore.writeOutput(taskId, outputStream -> reportWriter.write(flagged, outputStream));
            log.info("Report task {} succeeded. flagged={}", taskId, flagged.rowCount());
        } catch (DomainException | ApplicationException ex) {
            log.warn("Report task {} failed: {}", taskId, ex.getMessage());
            failure = FAILURE_PREFIX + ex.getMessage();
        } catch (InfrastructureException ex) {
            // file locations stay in the log
            log.warn("Report task {} failed: {} (location: {})", taskId, ex.getMessage(), ex.location());
            failure = FAILURE_PREFIX + STORAGE_FAILURE;
        } catch (RuntimeException ex) {
            log.error("Report task {} failed unexpectedly", taskId, ex);
            failure = FAILURE_PREFIX + ex.getMessage();
        } catch (Error err) {
            log.error("Report task {} aborted by {}", taskId, err.getClass().getName(), err);
            failure = FAILURE_PREFIX + INTERNAL_FAILURE;
            fatal = err;
        } finally {
            fileStore.delete(input);
        }

        if (failure == null) {
            taskRegistry.markSucceeded(taskId);
        } else {
            taskRegistry.markFailed(taskId, failure);
        }
        if (fatal != null) {
            throw fatal;
        }
    }

    private Path storeInput(String taskId, MultipartFile file) {
        try (InputStream content = file.getInputStream()) {
            return fileStore.saveInput(taskId, content);
        } catch (IOException ex) {
            throw new ReportStorageException("Unable to read the uploaded report.", fileStore.inputPath(taskId), ex);
        }
    }
}

package com.example.discrepancy.application.service;

import com.example.discrepancy.domain.model.ReportTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-wide map from task id to task state.
 * The submitting request creates the pending entry; afterwards the worker running the task is the only writer
 * of that entry, while any number of pollers may read it.
 */
@Component
public class ReportTaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(ReportTaskRegistry.class);

    private final Map<String, ReportTask> tasks = new ConcurrentHashMap<>();
    private final Clock clock;

    public ReportTaskRegistry() {
        this(Clock.systemUTC());
    }

    ReportTaskRegistry(Clock clock) {
        this.clock = clock;
    }

	/**
	 * Registers a new pending task.
	 *
	 * @param taskId     freshly generated handle
	 * @param outputPath where the result will be written
	 * @return the pending task
	 * @throws IllegalStateException when the id is already registered
	 */
    public ReportTask register(String taskId, Path outputPath) {
        ReportTask task = ReportTask.pending(taskId, outputPath, clock.instant());
        if (tasks.putIfAbsent(taskId, task) != null) {
            throw new IllegalStateException("Task already registered: " + taskId);
        }
        return task;
    }

    public void markSucceeded(String taskId) {
        finish(taskId, task -> task.succeeded(clock.instant()));
    }

    public void markFailed(String taskId, String reason) {
        finish(taskId, task -> task.failed(reason, clock.instant()));
    }

    public Optional<ReportTask> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

	/**
	 * Drops finished tasks older than the retention window. Pending tasks are never evicted.
	 *
	 * @param retention maximum age of a finished task
	 * @return number of evicted entries
	 */
    public int evictFinishedOlderThan(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        for (Map.Entry<String, ReportTask> entry : tasks.entrySet()) {
            ReportTask task = entry.getValue();
            if (task.status().isFinished() && task.finishedAt().isBefore(cutoff)
                    && tasks.remove(entry.getKey(), task)) {
                evicted++;
            }
        }
        return evicted;
    }

    private void finish(String taskId, UnaryOperator<ReportTask> transition) {
        ReportTask updated = tasks.computeIfPresent(taskId, (id, task) -> {
            if (task.status().isFinished()) {
                throw new IllegalStateException("Task " + id + " already finished with status " + task.status());
            }
            return transition.apply(task);
        });
        if (updated == null) {
            log.warn("Ignoring completion of unknown task {}", taskId);
        }
    }
}

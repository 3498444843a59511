package com.example.discrepancy.infrastructure.storage;

import com.example.discrepancy.application.service.ReportTaskRegistry;
import com.example.discrepancy.infrastructure.config.DiscrepancyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Removes report artifacts and finished task entries older than the retention window.
 * Runs once at startup, then periodically, independently of any running task.
 */
@Component
public class ExpiredReportSweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpiredReportSweeper.class);

    private final ReportFileStore fileStore;
    private final ReportTaskRegistry taskRegistry;
    private final Duration retention;

    public ExpiredReportSweeper(ReportFileStore fileStore, ReportTaskRegistry taskRegistry, DiscrepancyProperties properties) {
        this.fileStore = fileStore;
        this.taskRegistry = taskRegistry;
        this.retention = properties.getStorage().getRetention();
    }

    /**
     * Scheduled entry point that performs one sweep.
     */
    @Scheduled(initialDelay = 0, fixedDelayString = "${discrepancy.storage.sweep-interval-ms:600000}")
    public void sweep() {
        int files = fileStore.purgeOlderThan(retention, Instant.now());
        int tasks = taskRegistry.evictFinishedOlderThan(retention);
        if (files > 0 || tasks > 0) {
            log.info("Report sweep complete. files={}, tasks={}, retention={}", files, tasks, retention);
        }
    }
}

package com.example.discrepancy.infrastructure.config;

import com.example.discrepancy.application.service.QuantityNormalizer;
import com.example.discrepancy.domain.model.ReportColumns;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Enables binding of report-specific configuration properties and wires the beans derived from them.
 */
@Configuration
@EnableConfigurationProperties(DiscrepancyProperties.class)
public class DiscrepancyConfig {

    public static final String REPORT_TASK_EXECUTOR = "reportTaskExecutor";

    @Bean
    public ReportColumns reportColumns(DiscrepancyProperties properties) {
        return properties.getColumns().toReportColumns();
    }

    @Bean
    public QuantityNormalizer quantityNormalizer(DiscrepancyProperties properties) {
        return new QuantityNormalizer(properties.getUnitTokens());
    }

    /**
     * Bounded worker pool running one pipeline per submitted report.
     */
    @Bean(name = REPORT_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor reportTaskExecutor(DiscrepancyProperties properties) {
        DiscrepancyProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("report-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}

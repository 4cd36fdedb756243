package com.example.notificationscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the cron job scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "cron-scheduler")
public class CronSchedulerProperties {

    /**
     * Number of threads firing cron jobs
     */
    @Min(1)
    private int poolSize = 5;

    @NotBlank
    private String threadNamePrefix = "cron-job-";

    /**
     * Load every active cron job from the database once the application is ready
     */
    private boolean loadOnStartup = true;

    /**
     * Seconds to wait for running jobs on shutdown
     */
    @Min(0)
    private int awaitTerminationSeconds = 30;

    /**
     * Interval for refreshing gauge metrics from the database
     */
    @Min(1000)
    private long metricsUpdateIntervalMs = 60000;

    /**
     * Daily summary notification texts. The message is a format string receiving the unread count.
     */
    @NotBlank
    private String summaryTitle = "Daily notification summary";

    @NotBlank
    private String summaryMessage = "You have %d unread notifications";

    @NotBlank
    private String summarySenderId = "system";
}

package com.example.notificationscheduler.config;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.domain.enums.NotificationCategory;
import com.example.notificationscheduler.domain.repository.CronJobRepository;
import com.example.notificationscheduler.domain.repository.NotificationRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring cron jobs and notification delivery.
 * <p>
 * Exposes Prometheus metrics for:
 * - Live cron tasks and active definitions by job type
 * - Connected realtime sessions
 * - Unread notification backlog
 * - Job execution times and failures
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private static final String LIVE_TASKS = "live_tasks";
    private static final String CONNECTED_SESSIONS = "connected_sessions";
    private static final String UNREAD = "unread";

    private final MeterRegistry meterRegistry;
    private final CronJobRepository cronJobRepository;
    private final NotificationRepository notificationRepository;

    private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var type : JobType.values()) {
            var key = "type_" + type.getCode();
            gauges.put(key, new AtomicLong(0));

            Gauge.builder("cron_jobs_active_definitions", gauges.get(key), AtomicLong::get)
                    .tag("type", type.getCode())
                    .description("Number of active cron job definitions by type")
                    .register(meterRegistry);
        }

        gauges.put(LIVE_TASKS, new AtomicLong(0));
        Gauge.builder("cron_jobs_live_tasks", gauges.get(LIVE_TASKS), AtomicLong::get)
                .description("Number of cron tasks currently scheduled in memory")
                .register(meterRegistry);

        gauges.put(CONNECTED_SESSIONS, new AtomicLong(0));
        Gauge.builder("realtime_connected_sessions", gauges.get(CONNECTED_SESSIONS), AtomicLong::get)
                .description("Number of users with an open realtime connection")
                .register(meterRegistry);

        gauges.put(UNREAD, new AtomicLong(0));
        Gauge.builder("notifications_unread", gauges.get(UNREAD), AtomicLong::get)
                .description("Number of unread notifications across all users")
                .register(meterRegistry);
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${cron-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var type : JobType.values()) {
                gauges.get("type_" + type.getCode()).set(cronJobRepository.countByJobTypeAndActiveTrue(type));
            }
            gauges.get(UNREAD).set(notificationRepository.countByReadFalse());
        } catch (Exception e) {
            log.warn("Failed to refresh gauge metrics: {}", e.getMessage());
        }
    }

    public void updateLiveCronTasks(int count) {
        gauges.get(LIVE_TASKS).set(count);
    }

    public void updateConnectedSessions(int count) {
        gauges.get(CONNECTED_SESSIONS).set(count);
    }

    /**
     * Create a timer for job execution
     */
    public Timer.Sample startJobExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record job execution time
     */
    public void recordJobExecution(Timer.Sample sample, JobType jobType, boolean success) {
        sample.stop(Timer.builder("cron_job_execution_time")
                .tag("type", jobType.getCode())
                .tag("success", String.valueOf(success))
                .description("Cron job execution time")
                .register(meterRegistry));
    }

    /**
     * Record job failure
     */
    public void recordJobFailure(JobType jobType, String errorType) {
        meterRegistry.counter("cron_job_failures",
                "type", jobType.getCode(),
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    public void recordNotificationsCreated(NotificationCategory category, int count) {
        meterRegistry.counter("notifications_created", "category", category.getCode()).increment(count);
    }

    public void recordNotificationDelivered() {
        meterRegistry.counter("notifications_delivered").increment();
    }
}

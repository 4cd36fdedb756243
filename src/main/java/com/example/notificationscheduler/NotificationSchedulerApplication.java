package com.example.notificationscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Notification Scheduler Service Application
 * <p>
 * Delivers system-wide and user-to-user notifications to connected clients
 * in real time and runs cron jobs that are managed at runtime.
 * <p>
 * Features:
 * - WebSocket channel per connected user
 * - Scheduled notifications flushed by cron jobs
 * - Cron jobs added, updated, started and stopped without a restart
 * - One-time jobs that deactivate themselves after firing
 * - Slack alerting when a scheduled job fails
 */
@EnableScheduling
@SpringBootApplication
public class NotificationSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotificationSchedulerApplication.class, args);
    }
}

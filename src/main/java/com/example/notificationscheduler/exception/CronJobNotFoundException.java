package com.example.notificationscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for cron job not found
 */
@Getter
public class CronJobNotFoundException extends RuntimeException {

    private final UUID cronJobId;

    public CronJobNotFoundException(UUID cronJobId) {
        super("Cron job not found: " + cronJobId);
        this.cronJobId = cronJobId;
    }
}

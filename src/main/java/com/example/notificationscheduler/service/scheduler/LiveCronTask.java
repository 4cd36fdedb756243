package com.example.notificationscheduler.service.scheduler;

import lombok.Value;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * A scheduled timer and the definition snapshot it fires.
 */
@Value
public class LiveCronTask {

    ScheduledJobSnapshot snapshot;
    ScheduledFuture<?> future;
    Instant installedAt;

    /**
     * Stop future fires; a fire already running completes
     */
    public void cancel() {
        future.cancel(false);
    }
}

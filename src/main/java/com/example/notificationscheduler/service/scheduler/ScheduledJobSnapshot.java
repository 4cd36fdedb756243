package com.example.notificationscheduler.service.scheduler;

import com.example.notificationscheduler.domain.entity.CronJob;
import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.service.handler.payload.JobPayload;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Immutable copy of a cron job definition taken when its live task is installed.
 * Changes to the definition reach the scheduler only through remove and re-add.
 */
@Value
@Builder
public class ScheduledJobSnapshot {

    UUID id;
    String name;
    JobType jobType;
    CronSchedule schedule;
    JobPayload payload;

    public static ScheduledJobSnapshot of(CronJob job, CronSchedule schedule, JobPayload payload) {
        return ScheduledJobSnapshot.builder()
                .id(job.getId())
                .name(job.getName())
                .jobType(job.getJobType())
                .schedule(schedule)
                .payload(payload)
                .build();
    }

    public boolean isOneTime() {
        return schedule.isOneTime();
    }
}

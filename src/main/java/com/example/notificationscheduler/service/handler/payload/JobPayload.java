package com.example.notificationscheduler.service.handler.payload;

import com.example.notificationscheduler.domain.enums.JobType;

/**
 * Typed job data, one variant per {@link JobType}.
 * Parsed once from the stored JSON text by {@link JobPayloadParser}.
 */
public interface JobPayload {

    JobType getJobType();
}

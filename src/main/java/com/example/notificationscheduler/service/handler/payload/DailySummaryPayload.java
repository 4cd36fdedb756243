package com.example.notificationscheduler.service.handler.payload;

import com.example.notificationscheduler.domain.enums.JobType;

/**
 * Daily summary jobs take no data.
 */
public final class DailySummaryPayload implements JobPayload {

    public static final DailySummaryPayload INSTANCE = new DailySummaryPayload();

    private DailySummaryPayload() {
    }

    @Override
    public JobType getJobType() {
        return JobType.DAILY_SUMMARY;
    }

    @Override
    public String toString() {
        return "DailySummaryPayload";
    }
}

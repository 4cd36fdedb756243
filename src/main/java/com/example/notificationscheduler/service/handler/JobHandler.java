package com.example.notificationscheduler.service.handler;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.service.handler.payload.JobPayload;

/**
 * Interface for cron job handlers.
 * <p>
 * Each job type has a corresponding handler implementation
 * that knows how to run that kind of job.
 * <p>
 * Handlers should:
 * - Be stateless
 * - Return clear success/failure results rather than throw
 * - Not touch the job definition (last/next run is recorded by the scheduler)
 */
public interface JobHandler {

    /**
     * Get the job type this handler supports
     */
    JobType getJobType();

    /**
     * Run the job once
     *
     * @param payload typed job data, matching {@link #getJobType()}
     * @return Result of the execution
     */
    JobExecutionResult execute(JobPayload payload);

    default boolean supports(JobType jobType) {
        return getJobType() == jobType;
    }
}

package com.example.notificationscheduler.exception;

import com.example.notificationscheduler.domain.enums.JobType;
import lombok.Getter;

/**
 * Exception for cron job execution failures
 */
@Getter
public class JobExecutionException extends RuntimeException {

    private final JobType jobType;

    public JobExecutionException(JobType jobType, String message) {
        super(String.format("Job %s execution failed: %s", jobType.getCode(), message));
        this.jobType = jobType;
    }

    public JobExecutionException(JobType jobType, Exception cause) {
        super(String.format("Job %s execution failed: %s", jobType.getCode(), cause.getMessage()), cause);
        this.jobType = jobType;
    }
}

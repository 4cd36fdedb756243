package com.example.notificationscheduler.service.handler;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents the result of one cron job run.
 */
@Data
@Builder
public class JobExecutionResult {

    /**
     * Whether the execution was successful
     */
    private boolean success;

    /**
     * True when nothing was run, e.g. no handler is registered for the job type
     */
    private boolean skipped;

    /**
     * Error message if failed
     */
    private String errorMessage;

    /**
     * Error type/classification for metrics and alerts
     */
    private String errorType;

    /**
     * Counters reported by the handler (delivered, created, ...)
     */
    @Builder.Default
    private Map<String, Object> responseData = new LinkedHashMap<>();

    /**
     * Additional notes or context
     */
    private String notes;

    public static JobExecutionResult success() {
        return JobExecutionResult.builder().success(true).build();
    }

    public static JobExecutionResult skipped(String notes) {
        return JobExecutionResult.builder().success(true).skipped(true).notes(notes).build();
    }

    public static JobExecutionResult failure(String errorMessage, String errorType) {
        return JobExecutionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .build();
    }

    /**
     * Create a failure result from exception
     */
    public static JobExecutionResult failure(Exception e) {
        return failure(e.getMessage(), e.getClass().getSimpleName());
    }

    /**
     * Add response data entry
     */
    public JobExecutionResult withResponseData(String key, Object value) {
        if (this.responseData == null) {
            this.responseData = new LinkedHashMap<>();
        }
        this.responseData.put(key, value);
        return this;
    }

    public JobExecutionResult withNotes(String notes) {
        this.notes = notes;
        return this;
    }
}

package com.example.notificationscheduler.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Defines the kinds of cron jobs that can be scheduled.
 * Each job type maps to a specific handler implementation.
 */
@Getter
@RequiredArgsConstructor
public enum JobType {

    /**
     * Flush due scheduled notifications, optionally broadcasting a system notification from the job data
     */
    NOTIFICATION_CHECK("notification_check", "Notification Check"),

    /**
     * Send every user with unread notifications a summary of their unread count
     */
    DAILY_SUMMARY("daily_summary", "Daily Summary"),

    /**
     * Deployment-specific job with opaque JSON data
     */
    CUSTOM("custom", "Custom Job");

    @JsonValue
    private final String code;
    private final String displayName;

    /**
     * Find JobType by its code value, accepting the enum name as well
     */
    @JsonCreator
    public static JobType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code) || type.name().equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job type code: " + code);
    }
}

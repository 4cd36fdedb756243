package com.example.notificationscheduler.service.handler.payload;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.domain.enums.NotificationType;
import lombok.Builder;
import lombok.Value;

/**
 * Optional system broadcast carried by a notification check job.
 * Without title and message the job only flushes due scheduled notifications.
 */
@Value
@Builder
public class NotificationCheckPayload implements JobPayload {

    public static final NotificationCheckPayload EMPTY = NotificationCheckPayload.builder().build();

    String title;
    String message;
    NotificationType type;

    /**
     * Set when the stored data could not be read; the broadcast is skipped
     */
    String formatError;

    public static NotificationCheckPayload invalid(String formatError) {
        return NotificationCheckPayload.builder().formatError(formatError).build();
    }

    public boolean hasBroadcast() {
        return formatError == null && title != null && message != null;
    }

    public NotificationType getTypeOrDefault() {
        return type != null ? type : NotificationType.INFO;
    }

    @Override
    public JobType getJobType() {
        return JobType.NOTIFICATION_CHECK;
    }
}

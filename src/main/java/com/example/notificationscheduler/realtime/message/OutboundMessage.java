package com.example.notificationscheduler.realtime.message;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Server to client frame: {@code {type, data}}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OutboundMessage<T> {

    public static final String NOTIFICATION = "notification";
    public static final String CRONJOB_STATUS = "cronjob_status";

    private String type;
    private T data;

    public static OutboundMessage<NotificationMessageData> notification(NotificationMessageData data) {
        return new OutboundMessage<>(NOTIFICATION, data);
    }

    public static OutboundMessage<CronJobStatusData> cronJobStatus(CronJobStatusData data) {
        return new OutboundMessage<>(CRONJOB_STATUS, data);
    }
}

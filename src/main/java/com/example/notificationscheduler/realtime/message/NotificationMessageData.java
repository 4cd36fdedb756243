package com.example.notificationscheduler.realtime.message;

import com.example.notificationscheduler.domain.entity.Notification;
import com.example.notificationscheduler.domain.enums.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationMessageData {

    private UUID id;
    private String title;
    private String message;
    private NotificationType type;
    private Instant createdAt;

    public static NotificationMessageData from(Notification notification) {
        return NotificationMessageData.builder()
                .id(notification.getId())
                .title(notification.getTitle())
                .message(notification.getMessage())
                .type(notification.getType())
                .createdAt(notification.getCreatedAt())
                .build();
    }
}

package com.example.notificationscheduler.dto;

import com.example.notificationscheduler.domain.enums.NotificationCategory;
import com.example.notificationscheduler.domain.enums.NotificationType;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for notification data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationResponse {

    private UUID id;
    private String userId;
    private String senderId;
    private String title;
    private String message;
    private NotificationType type;
    private NotificationCategory category;

    @JsonProperty("isRead")
    private Boolean read;

    @JsonProperty("isSent")
    private Boolean sent;

    private Instant scheduledAt;
    private Instant createdAt;
}

package com.example.notificationscheduler.dto;

import com.example.notificationscheduler.domain.enums.NotificationType;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO for creating a system or user-to-user notification
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateNotificationRequest {

    /**
     * "system" or "user-to-user"; checked by the service so an unknown value yields 400 with a clear message
     */
    @NotBlank(message = "Category is required")
    private String category;

    @NotBlank(message = "Title is required")
    private String title;

    @NotBlank(message = "Message is required")
    private String message;

    /**
     * Defaults to info
     */
    private NotificationType type;

    /**
     * Recipient, required for user-to-user
     */
    private String userId;

    private String senderId;

    /**
     * Deliver later instead of immediately
     */
    private Instant scheduledAt;
}

package com.example.notificationscheduler.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Origin of a notification.
 */
@Getter
@RequiredArgsConstructor
public enum NotificationCategory {

    /**
     * Fanned out to every known user, no sender
     */
    SYSTEM("system"),

    /**
     * Exactly one recipient and an explicit sender
     */
    USER_TO_USER("user-to-user");

    @JsonValue
    private final String code;

    public static NotificationCategory fromCode(String code) {
        for (var category : values()) {
            if (category.getCode().equals(code)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Invalid category. Must be \"system\" or \"user-to-user\"");
    }
}

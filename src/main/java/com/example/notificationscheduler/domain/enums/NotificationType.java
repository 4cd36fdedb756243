package com.example.notificationscheduler.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Severity of a notification as shown by the client.
 */
@Getter
@RequiredArgsConstructor
public enum NotificationType {

    INFO("info"),
    WARNING("warning"),
    SUCCESS("success"),
    ERROR("error");

    @JsonValue
    private final String code;

    @JsonCreator
    public static NotificationType fromCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code) || type.name().equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown notification type: " + code);
    }

    /**
     * Lenient lookup used when reading job data
     */
    public static boolean isValidCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code)) {
                return true;
            }
        }
        return false;
    }
}

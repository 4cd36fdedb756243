package com.example.notificationscheduler.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class NotificationNotFoundException extends RuntimeException {

    private final UUID notificationId;

    public NotificationNotFoundException(UUID notificationId) {
        super("Notification not found: " + notificationId);
        this.notificationId = notificationId;
    }
}

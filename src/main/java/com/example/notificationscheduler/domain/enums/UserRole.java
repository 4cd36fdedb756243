package com.example.notificationscheduler.domain.enums;

/**
 * Role of a user. Admins receive cron job status updates over the realtime channel.
 */
public enum UserRole {
    ADMIN,
    USER
}

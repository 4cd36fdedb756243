package com.example.notificationscheduler.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Cron job lifecycle event pushed to connected admins.
 */
@Getter
@RequiredArgsConstructor
public enum JobStatusEvent {

    STARTED("started"),
    STOPPED("stopped"),
    EXECUTED("executed"),
    FAILED("failed");

    @JsonValue
    private final String code;
}

package com.example.notificationscheduler.service.handler.payload;

import com.example.notificationscheduler.domain.enums.JobType;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Opaque data of a custom job: either parsed JSON or the raw text that failed to parse.
 */
@Value
public class CustomPayload implements JobPayload {

    public static final CustomPayload EMPTY = new CustomPayload(null, null, null);

    JsonNode data;
    String raw;
    String formatError;

    public static CustomPayload of(JsonNode data) {
        return new CustomPayload(data, null, null);
    }

    public static CustomPayload malformed(String raw, String formatError) {
        return new CustomPayload(null, raw, formatError);
    }

    public boolean isMalformed() {
        return formatError != null;
    }

    @Override
    public JobType getJobType() {
        return JobType.CUSTOM;
    }
}

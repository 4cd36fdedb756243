package com.example.notificationscheduler.service.handler.payload;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.domain.enums.NotificationType;
import com.example.notificationscheduler.exception.InvalidCronJobException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns stored job data text into a typed {@link JobPayload}.
 * <p>
 * {@link #parseStrict} is used when a definition is created or updated and rejects bad data.
 * {@link #parseLenient} is used when jobs are loaded into the scheduler; bad data becomes a
 * payload carrying the format error so the job still runs and reports it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobPayloadParser {

    static final String INVALID_JSON = "jobData must be valid JSON format";
    static final String MISSING_TITLE = "jobData must contain \"title\" field (string) for notification_check jobs";
    static final String MISSING_MESSAGE = "jobData must contain \"message\" field (string) for notification_check jobs";
    static final String INVALID_TYPE = "jobData \"type\" must be one of: info, warning, success, error";

    private final ObjectMapper objectMapper;

    /**
     * @throws InvalidCronJobException when notification check data is not a JSON object with title and message
     */
    public JobPayload parseStrict(JobType jobType, String jobData) {
        if (jobType == JobType.NOTIFICATION_CHECK && hasText(jobData)) {
            var node = readTree(jobData);
            if (node == null) {
                throw new InvalidCronJobException(INVALID_JSON);
            }
            var payload = toNotificationCheck(node);
            if (payload.getFormatError() != null) {
                throw new InvalidCronJobException(payload.getFormatError());
            }
            return payload;
        }
        return parseLenient(jobType, jobData);
    }

    public JobPayload parseLenient(JobType jobType, String jobData) {
        if (jobType == JobType.NOTIFICATION_CHECK) {
            return parseNotificationCheck(jobData);
        }
        if (jobType == JobType.DAILY_SUMMARY) {
            return DailySummaryPayload.INSTANCE;
        }
        return parseCustom(jobData);
    }

    private NotificationCheckPayload parseNotificationCheck(String jobData) {
        if (!hasText(jobData)) {
            return NotificationCheckPayload.EMPTY;
        }
        var node = readTree(jobData);
        if (node == null) {
            return NotificationCheckPayload.invalid(INVALID_JSON);
        }
        return toNotificationCheck(node);
    }

    private NotificationCheckPayload toNotificationCheck(JsonNode node) {
        if (!node.isObject()) {
            return NotificationCheckPayload.invalid(INVALID_JSON);
        }
        var title = node.get("title");
        if (title == null || !title.isTextual()) {
            return NotificationCheckPayload.invalid(MISSING_TITLE);
        }
        var message = node.get("message");
        if (message == null || !message.isTextual()) {
            return NotificationCheckPayload.invalid(MISSING_MESSAGE);
        }
        NotificationType type = null;
        var typeNode = node.get("type");
        if (typeNode != null && !typeNode.isNull()) {
            if (!typeNode.isTextual() || !NotificationType.isValidCode(typeNode.asText())) {
                return NotificationCheckPayload.invalid(INVALID_TYPE);
            }
            type = NotificationType.fromCode(typeNode.asText());
        }
        return NotificationCheckPayload.builder()
                .title(title.asText())
                .message(message.asText())
                .type(type)
                .build();
    }

    private CustomPayload parseCustom(String jobData) {
        if (!hasText(jobData)) {
            return CustomPayload.EMPTY;
        }
        var node = readTree(jobData);
        return node != null ? CustomPayload.of(node) : CustomPayload.malformed(jobData, INVALID_JSON);
    }

    private JsonNode readTree(String jobData) {
        try {
            return objectMapper.readTree(jobData);
        } catch (JsonProcessingException e) {
            log.debug("Job data is not valid JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

package com.example.notificationscheduler.service.handler;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.service.NotificationService;
import com.example.notificationscheduler.service.handler.payload.JobPayload;
import com.example.notificationscheduler.service.handler.payload.NotificationCheckPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Handler for NOTIFICATION_CHECK jobs.
 * <p>
 * Delivers every scheduled notification that is due to its recipient (when connected)
 * and marks it sent. When the job data carries a title and message it then creates
 * and broadcasts a system notification, so one recurring job can also act as a
 * scheduled broadcast.
 * <p>
 * Expected payload (optional):
 * - title, message: broadcast texts
 * - type: info, warning, success or error (defaults to info)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationCheckHandler implements JobHandler {

    private final NotificationService notificationService;
    private final Clock clock;

    @Override
    public JobType getJobType() {
        return JobType.NOTIFICATION_CHECK;
    }

    @Override
    public JobExecutionResult execute(JobPayload payload) {
        var data = payload instanceof NotificationCheckPayload ? (NotificationCheckPayload) payload : NotificationCheckPayload.EMPTY;

        try {
            var due = notificationService.flushScheduled(clock.instant());
            var delivered = 0;
            for (var notification : due) {
                if (notificationService.deliver(notification)) {
                    delivered++;
                }
                notificationService.markSent(notification.getId());
            }
            if (!due.isEmpty()) {
                log.info("Flushed {} scheduled notifications, {} delivered", due.size(), delivered);
            }

            var result = JobExecutionResult.success()
                    .withResponseData("flushed", due.size())
                    .withResponseData("delivered", delivered);

            if (data.getFormatError() != null) {
                log.warn("Notification check job data ignored: {}", data.getFormatError());
                return result.withNotes(data.getFormatError());
            }

            if (data.hasBroadcast()) {
                var created = notificationService.createSystemNotification(
                        data.getTitle(), data.getMessage(), data.getTypeOrDefault(), null);
                log.info("Broadcast system notification '{}' to {} users", data.getTitle(), created.size());
                result.withResponseData("broadcast", created.size());
            }

            return result;
        } catch (Exception e) {
            log.error("Notification check failed: {}", e.getMessage(), e);
            return JobExecutionResult.failure(e);
        }
    }
}

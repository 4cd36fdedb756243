package com.example.notificationscheduler.service.handler;

import com.example.notificationscheduler.config.CronSchedulerProperties;
import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.domain.enums.NotificationType;
import com.example.notificationscheduler.service.NotificationService;
import com.example.notificationscheduler.service.handler.payload.JobPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Handler for DAILY_SUMMARY jobs.
 * <p>
 * Sends each user with unread notifications a notification stating the unread count.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DailySummaryHandler implements JobHandler {

    private final NotificationService notificationService;
    private final CronSchedulerProperties properties;

    @Override
    public JobType getJobType() {
        return JobType.DAILY_SUMMARY;
    }

    @Override
    public JobExecutionResult execute(JobPayload payload) {
        try {
            var unreadByUser = notificationService.findUsersWithUnread();

            for (var entry : unreadByUser.entrySet()) {
                notificationService.createUserNotification(
                        entry.getKey(),
                        properties.getSummarySenderId(),
                        properties.getSummaryTitle(),
                        String.format(properties.getSummaryMessage(), entry.getValue()),
                        NotificationType.INFO,
                        null);
            }

            log.info("Daily summary sent to {} users", unreadByUser.size());
            return JobExecutionResult.success().withResponseData("users", unreadByUser.size());
        } catch (Exception e) {
            log.error("Daily summary failed: {}", e.getMessage(), e);
            return JobExecutionResult.failure(e);
        }
    }
}

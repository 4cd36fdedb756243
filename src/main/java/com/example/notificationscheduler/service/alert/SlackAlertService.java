package com.example.notificationscheduler.service.alert;

import com.example.notificationscheduler.config.SlackProperties;
import com.example.notificationscheduler.domain.enums.JobType;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Service for sending alerts to Slack about cron jobs.
 * <p>
 * A failed run never stops the job, so the alert is the only signal
 * that a definition keeps failing on every tick.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final int MAX_ERROR_LENGTH = 400;

    private final SlackProperties slackProperties;
    private final Clock clock;
    private final Slack slack;

    @Value("${spring.application.name:notification-scheduler}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties, Clock clock) {
        this(slackProperties, clock, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Clock clock, Slack slack) {
        this.slackProperties = slackProperties;
        this.clock = clock;
        this.slack = slack;
    }

    /**
     * Alert that a scheduled run failed. Runs asynchronously to not block the scheduler thread.
     */
    @Async
    public void sendJobFailureAlert(UUID jobId, String jobName, JobType jobType, String errorMessage) {
        var attachment = Attachment.builder()
                .color("danger")
                .title(jobType.getDisplayName() + " - " + jobName)
                .titleLink(buildJobLink(jobId))
                .fields(List.of(
                        field("Job ID", String.valueOf(jobId), true),
                        field("Job Type", jobType.getCode(), true),
                        field("Error", "```" + truncate(errorMessage) + "```", false)))
                .footer(applicationName + " | The job stays scheduled")
                .ts(timestamp())
                .build();

        send(":rotating_light:", "*Cron Job Failed*", attachment, "failed cron job " + jobId);
    }

    /**
     * Alert that an active definition could not be scheduled on startup and will not fire
     */
    @Async
    public void sendJobLoadFailureAlert(UUID jobId, String jobName, String cronExpression, String errorMessage) {
        var attachment = Attachment.builder()
                .color("warning")
                .title(jobName)
                .titleLink(buildJobLink(jobId))
                .fields(List.of(
                        field("Job ID", String.valueOf(jobId), true),
                        field("Schedule", cronExpression, true),
                        field("Error", truncate(errorMessage), false)))
                .footer(applicationName + " | Fix the definition and start it again")
                .ts(timestamp())
                .build();

        send(":warning:", "*Cron Job Not Scheduled*", attachment, "unloadable cron job " + jobId);
    }

    private void send(String emoji, String headline, Attachment attachment, String subject) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured, no alert sent for {}", subject);
            return;
        }

        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(emoji)
                .text(emoji + " " + headline)
                .attachments(List.of(attachment))
                .build();

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert for {}. Response code: {}, body: {}",
                        subject, response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for {}", subject);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for {}: {}", subject, e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled()
                && slackProperties.getWebhookUrl() != null
                && !slackProperties.getWebhookUrl().isBlank();
    }

    private Field field(String title, String value, boolean isShort) {
        return Field.builder().title(title).value(value).valueShortEnough(isShort).build();
    }

    private String timestamp() {
        return String.valueOf(clock.instant().getEpochSecond());
    }

    private String buildJobLink(UUID jobId) {
        return slackProperties.getDashboardBaseUrl() + "/cronjobs/" + jobId;
    }

    private String truncate(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= MAX_ERROR_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}

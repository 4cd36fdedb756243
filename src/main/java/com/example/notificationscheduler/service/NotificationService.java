package com.example.notificationscheduler.service;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.domain.entity.Notification;
import com.example.notificationscheduler.domain.enums.JobStatusEvent;
import com.example.notificationscheduler.domain.enums.NotificationCategory;
import com.example.notificationscheduler.domain.enums.NotificationType;
import com.example.notificationscheduler.domain.enums.UserRole;
import com.example.notificationscheduler.domain.repository.NotificationRepository;
import com.example.notificationscheduler.domain.repository.UserRepository;
import com.example.notificationscheduler.dto.CreateNotificationRequest;
import com.example.notificationscheduler.exception.NotificationNotFoundException;
import com.example.notificationscheduler.realtime.ConnectionRegistry;
import com.example.notificationscheduler.realtime.message.CronJobStatusData;
import com.example.notificationscheduler.realtime.message.NotificationMessageData;
import com.example.notificationscheduler.realtime.message.OutboundMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Creates notifications, tracks their read/sent state and pushes them to connected users.
 * <p>
 * Immediate notifications are pushed right after they are stored. Scheduled ones
 * ({@code scheduledAt} set) stay unsent until a notification check job flushes them.
 * A user who is not connected receives all unread notifications on the next registration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final UserRepository userRepository;
    private final ConnectionRegistry connectionRegistry;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    // ========== Creation ==========

    /**
     * Create one system notification per known user and broadcast them unless scheduled
     */
    @Transactional
    public List<Notification> createSystemNotification(String title, String message, NotificationType type, Instant scheduledAt) {
        var users = userRepository.findAll();
        var notifications = new ArrayList<Notification>(users.size());

        for (var user : users) {
            notifications.add(notificationRepository.save(Notification.builder()
                    .userId(user.getId())
                    .title(title)
                    .message(message)
                    .type(type != null ? type : NotificationType.INFO)
                    .category(NotificationCategory.SYSTEM)
                    .scheduledAt(scheduledAt)
                    .build()));
        }

        log.info("Created {} system notifications '{}'{}", notifications.size(), title,
                scheduledAt != null ? " scheduled at " + scheduledAt : "");
        metricsConfig.recordNotificationsCreated(NotificationCategory.SYSTEM, notifications.size());

        if (scheduledAt == null) {
            broadcast(notifications);
        }
        return notifications;
    }

    /**
     * Create a notification for one recipient and push it if unscheduled and the recipient is connected
     */
    @Transactional
    public Notification createUserNotification(String recipientId, String senderId, String title, String message,
                                               NotificationType type, Instant scheduledAt) {
        var notification = notificationRepository.save(Notification.builder()
                .userId(recipientId)
                .senderId(senderId)
                .title(title)
                .message(message)
                .type(type != null ? type : NotificationType.INFO)
                .category(NotificationCategory.USER_TO_USER)
                .scheduledAt(scheduledAt)
                .build());

        log.debug("Created notification {} for user {} from {}", notification.getId(), recipientId, senderId);
        metricsConfig.recordNotificationsCreated(NotificationCategory.USER_TO_USER, 1);

        if (scheduledAt == null && connectionRegistry.isConnected(recipientId)) {
            deliver(notification);
        }
        return notification;
    }

    /**
     * Create notifications from an API request
     *
     * @throws IllegalArgumentException for an unknown category or a user-to-user request without recipient
     */
    @Transactional
    public List<Notification> publish(CreateNotificationRequest request) {
        var category = NotificationCategory.fromCode(request.getCategory());

        if (category == NotificationCategory.SYSTEM) {
            return createSystemNotification(request.getTitle(), request.getMessage(), request.getType(), request.getScheduledAt());
        }

        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new IllegalArgumentException("userId is required for user-to-user notifications");
        }
        return List.of(createUserNotification(request.getUserId(), request.getSenderId(), request.getTitle(),
                request.getMessage(), request.getType(), request.getScheduledAt()));
    }

    // ========== Read state ==========

    @Transactional(readOnly = true)
    public List<Notification> getUnread(String userId) {
        return notificationRepository.findByUserIdAndReadFalseOrderByCreatedAtDesc(userId);
    }

    @Transactional
    public Notification markRead(UUID notificationId) {
        var notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> new NotificationNotFoundException(notificationId));

        notification.setRead(true);
        return notificationRepository.save(notification);
    }

    /**
     * @return number of notifications that were unread
     */
    public int markAllRead(String userId) {
        var count = notificationRepository.markAllRead(userId, clock.instant());
        log.info("Marked {} notifications as read for user {}", count, userId);
        return count;
    }

    // ========== Scheduled delivery ==========

    /**
     * Notifications due at {@code now} that have not been sent yet, oldest first
     */
    @Transactional(readOnly = true)
    public List<Notification> flushScheduled(Instant now) {
        return notificationRepository.findDueScheduled(now);
    }

    public void markSent(UUID notificationId) {
        notificationRepository.markSent(notificationId, clock.instant());
    }

    /**
     * Unread counts keyed by user id, for users with at least one unread notification
     */
    @Transactional(readOnly = true)
    public Map<String, Long> findUsersWithUnread() {
        var result = new LinkedHashMap<String, Long>();
        for (var row : notificationRepository.countUnreadByUser()) {
            result.put((String) row[0], ((Number) row[1]).longValue());
        }
        return result;
    }

    // ========== Delivery ==========

    /**
     * Push a notification to its recipient; no-op when the recipient is not connected
     *
     * @return true when the frame was written
     */
    public boolean deliver(Notification notification) {
        var sent = connectionRegistry.sendTo(notification.getUserId(),
                OutboundMessage.notification(NotificationMessageData.from(notification)));
        if (sent) {
            metricsConfig.recordNotificationDelivered();
        }
        return sent;
    }

    /**
     * @return number of notifications pushed
     */
    public int broadcast(List<Notification> notifications) {
        var delivered = 0;
        for (var notification : notifications) {
            if (deliver(notification)) {
                delivered++;
            }
        }
        log.debug("Broadcast {} notifications, {} delivered", notifications.size(), delivered);
        return delivered;
    }

    /**
     * Push every unread notification of a user that just connected
     *
     * @return number of notifications pushed
     */
    public int deliverUnread(String userId) {
        var unread = getUnread(userId);
        var delivered = broadcast(unread);
        if (!unread.isEmpty()) {
            log.info("Delivered {} of {} unread notifications to user {}", delivered, unread.size(), userId);
        }
        return delivered;
    }

    /**
     * Push a cron job lifecycle event to every connected admin. Failures are logged only.
     */
    public void sendJobStatusToAdmins(UUID cronJobId, JobStatusEvent status, String message) {
        try {
            var frame = OutboundMessage.cronJobStatus(CronJobStatusData.builder()
                    .cronJobId(cronJobId)
                    .status(status)
                    .message(message)
                    .timestamp(clock.instant())
                    .build());

            for (var admin : userRepository.findByRole(UserRole.ADMIN)) {
                connectionRegistry.sendTo(admin.getId(), frame);
            }
        } catch (Exception e) {
            log.warn("Failed to send {} status of cron job {} to admins: {}", status.getCode(), cronJobId, e.getMessage());
        }
    }
}

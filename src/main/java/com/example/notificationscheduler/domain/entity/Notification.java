package com.example.notificationscheduler.domain.entity;

import com.example.notificationscheduler.domain.enums.NotificationCategory;
import com.example.notificationscheduler.domain.enums.NotificationType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A notification addressed to exactly one user.
 * <p>
 * System notifications are fanned out as one row per user; rows are never shared.
 * A row with {@code scheduledAt} set stays unsent until a notification check job
 * delivers it after that instant.
 */
@Entity
@Table(name = "notifications", indexes = {
        @Index(name = "idx_notification_user_read", columnList = "user_id, is_read"),
        @Index(name = "idx_notification_scheduled_sent", columnList = "scheduled_at, is_sent")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Recipient
     */
    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    /**
     * Sender, null for system notifications
     */
    @Column(name = "sender_id", length = 100)
    private String senderId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "message", nullable = false, columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    @Builder.Default
    private NotificationType type = NotificationType.INFO;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private NotificationCategory category;

    @Column(name = "is_read", nullable = false)
    @Builder.Default
    private Boolean read = false;

    @Column(name = "is_sent", nullable = false)
    @Builder.Default
    private Boolean sent = false;

    /**
     * Deliver at or after this instant; null means deliver immediately
     */
    @Column(name = "scheduled_at")
    private Instant scheduledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.type == null) {
            this.type = NotificationType.INFO;
        }
        if (this.read == null) {
            this.read = false;
        }
        if (this.sent == null) {
            this.sent = false;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}

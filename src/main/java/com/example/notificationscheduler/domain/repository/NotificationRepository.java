package com.example.notificationscheduler.domain.repository;

import com.example.notificationscheduler.domain.entity.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for notifications.
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    /**
     * Unread notifications for a user, newest first
     */
    List<Notification> findByUserIdAndReadFalseOrderByCreatedAtDesc(String userId);

    long countByUserIdAndReadFalse(String userId);

    long countByReadFalse();

    /**
     * Scheduled notifications that are due and not yet delivered
     */
    @Query("""
            SELECT n FROM Notification n
            WHERE n.scheduledAt IS NOT NULL
              AND n.scheduledAt <= :now
              AND n.sent = false
            ORDER BY n.scheduledAt ASC
            """)
    List<Notification> findDueScheduled(@Param("now") Instant now);

    /**
     * Mark every unread notification of a user as read
     *
     * @return number of rows updated
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE Notification n
            SET n.read = true,
                n.updatedAt = :now
            WHERE n.userId = :userId
              AND n.read = false
            """)
    int markAllRead(@Param("userId") String userId, @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("""
            UPDATE Notification n
            SET n.sent = true,
                n.updatedAt = :now
            WHERE n.id = :id
            """)
    int markSent(@Param("id") UUID id, @Param("now") Instant now);

    /**
     * Unread counts grouped by recipient: rows of [userId, count]
     */
    @Query("""
            SELECT n.userId, COUNT(n)
            FROM Notification n
            WHERE n.read = false
            GROUP BY n.userId
            """)
    List<Object[]> countUnreadByUser();
}

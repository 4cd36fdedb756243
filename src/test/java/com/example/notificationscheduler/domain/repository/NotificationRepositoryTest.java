package com.example.notificationscheduler.domain.repository;

import com.example.notificationscheduler.TestcontainersConfiguration;
import com.example.notificationscheduler.domain.entity.Notification;
import com.example.notificationscheduler.domain.enums.NotificationCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(TestcontainersConfiguration.class)
@DisplayName("NotificationRepository Tests")
class NotificationRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Autowired
    private NotificationRepository notificationRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Nested
    @DisplayName("findDueScheduled Tests")
    class FindDueScheduledTests {

        @Test
        @DisplayName("Should return unsent rows scheduled at or before now, oldest first")
        void shouldReturnDueRowsOnly() {
            // Given
            var overdue = persist(notification("u1", false, false, NOW.minus(Duration.ofHours(1))));
            var exactlyDue = persist(notification("u2", false, false, NOW));
            persist(notification("u1", false, false, NOW.plusSeconds(1)));
            persist(notification("u1", false, true, NOW.minus(Duration.ofHours(2))));
            persist(notification("u1", false, false, null));

            // When
            var due = notificationRepository.findDueScheduled(NOW);

            // Then
            assertThat(due).extracting(Notification::getId)
                    .containsExactly(overdue.getId(), exactlyDue.getId());
        }

        @Test
        @DisplayName("Should stop returning a row once it is marked sent")
        void shouldExcludeRowAfterMarkSent() {
            var scheduled = persist(notification("u1", false, false, NOW.minusSeconds(30)));

            var updated = notificationRepository.markSent(scheduled.getId(), NOW);
            entityManager.clear();

            assertThat(updated).isEqualTo(1);
            assertThat(notificationRepository.findDueScheduled(NOW)).isEmpty();
            assertThat(entityManager.find(Notification.class, scheduled.getId()).getSent()).isTrue();
        }
    }

    @Nested
    @DisplayName("Read state Tests")
    class ReadStateTests {

        @Test
        @DisplayName("Should mark only the user's unread rows and report how many changed")
        void shouldMarkAllRead() {
            // Given
            persist(notification("u1", false, false, null));
            persist(notification("u1", false, false, null));
            persist(notification("u1", true, false, null));
            persist(notification("u2", false, false, null));

            // When
            var updated = notificationRepository.markAllRead("u1", NOW);
            entityManager.clear();

            // Then
            assertThat(updated).isEqualTo(2);
            assertThat(notificationRepository.findByUserIdAndReadFalseOrderByCreatedAtDesc("u1")).isEmpty();
            assertThat(notificationRepository.countByUserIdAndReadFalse("u2")).isEqualTo(1);
            assertThat(notificationRepository.markAllRead("u1", NOW)).isZero();
        }

        @Test
        @DisplayName("Should group unread counts by recipient")
        void shouldCountUnreadByUser() {
            persist(notification("u1", false, false, null));
            persist(notification("u1", false, false, null));
            persist(notification("u2", false, false, null));
            persist(notification("u3", true, false, null));

            Map<String, Long> counts = notificationRepository.countUnreadByUser().stream()
                    .collect(Collectors.toMap(row -> (String) row[0], row -> ((Number) row[1]).longValue()));

            assertThat(counts).containsOnly(Map.entry("u1", 2L), Map.entry("u2", 1L));
            assertThat(notificationRepository.countByReadFalse()).isEqualTo(3);
        }
    }

    private Notification persist(Notification notification) {
        return entityManager.persistAndFlush(notification);
    }

    private Notification notification(String userId, boolean read, boolean sent, Instant scheduledAt) {
        return Notification.builder()
                .userId(userId)
                .title("Title")
                .message("Message")
                .category(NotificationCategory.SYSTEM)
                .read(read)
                .sent(sent)
                .scheduledAt(scheduledAt)
                .build();
    }
}

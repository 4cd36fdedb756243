package com.example.notificationscheduler.service;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.domain.entity.AppUser;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationService Tests")
class NotificationServiceTest {

    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private ConnectionRegistry connectionRegistry;

    @Mock
    private MetricsConfig metricsConfig;

    @Captor
    private ArgumentCaptor<Notification> notificationCaptor;

    @Captor
    private ArgumentCaptor<Object> messageCaptor;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(notificationRepository, userRepository, connectionRegistry,
                metricsConfig, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private AppUser user(String id, UserRole role) {
        return AppUser.builder().id(id).email(id + "@example.com").role(role).build();
    }

    private Notification unread(String userId) {
        return Notification.builder()
                .id(UUID.randomUUID())
                .userId(userId)
                .title("t")
                .message("m")
                .category(NotificationCategory.USER_TO_USER)
                .createdAt(NOW)
                .build();
    }

    private void stubSaveAssigningIds() {
        when(notificationRepository.save(any(Notification.class))).thenAnswer(inv -> {
            Notification notification = inv.getArgument(0);
            notification.setId(UUID.randomUUID());
            return notification;
        });
    }

    @Nested
    @DisplayName("System notification Tests")
    class SystemNotificationTests {

        @Test
        @DisplayName("Should create one system record per user and broadcast them")
        void shouldFanOutToEveryUser() {
            // Given
            when(userRepository.findAll()).thenReturn(List.of(
                    user("u1", UserRole.USER), user("u2", UserRole.USER), user("admin", UserRole.ADMIN)));
            stubSaveAssigningIds();
            when(connectionRegistry.sendTo(anyString(), any())).thenReturn(true, false, true);

            // When
            var created = notificationService.createSystemNotification("Maintenance", "Tonight", NotificationType.WARNING, null);

            // Then
            assertThat(created).hasSize(3);
            verify(notificationRepository, times(3)).save(notificationCaptor.capture());
            assertThat(notificationCaptor.getAllValues())
                    .allSatisfy(notification -> {
                        assertThat(notification.getCategory()).isEqualTo(NotificationCategory.SYSTEM);
                        assertThat(notification.getTitle()).isEqualTo("Maintenance");
                        assertThat(notification.getMessage()).isEqualTo("Tonight");
                        assertThat(notification.getSenderId()).isNull();
                    })
                    .extracting(Notification::getUserId)
                    .containsExactly("u1", "u2", "admin");
            verify(connectionRegistry, times(3)).sendTo(anyString(), any());
            verify(metricsConfig).recordNotificationsCreated(NotificationCategory.SYSTEM, 3);
            verify(metricsConfig, times(2)).recordNotificationDelivered();
        }

        @Test
        @DisplayName("Should not push scheduled system notifications")
        void shouldNotPushScheduled() {
            when(userRepository.findAll()).thenReturn(List.of(user("u1", UserRole.USER)));
            stubSaveAssigningIds();

            var created = notificationService.createSystemNotification("Later", "Soon", null, NOW.plusSeconds(3600));

            assertThat(created).singleElement().satisfies(notification -> {
                assertThat(notification.getScheduledAt()).isEqualTo(NOW.plusSeconds(3600));
                assertThat(notification.getType()).isEqualTo(NotificationType.INFO);
            });
            verifyNoInteractions(connectionRegistry);
        }
    }

    @Nested
    @DisplayName("User notification Tests")
    class UserNotificationTests {

        @Test
        @DisplayName("Should push to a connected recipient")
        void shouldPushToConnectedRecipient() {
            stubSaveAssigningIds();
            when(connectionRegistry.isConnected("u2")).thenReturn(true);
            when(connectionRegistry.sendTo(eq("u2"), any())).thenReturn(true);

            var created = notificationService.createUserNotification("u2", "u1", "Hi", "There", NotificationType.INFO, null);

            assertThat(created.getCategory()).isEqualTo(NotificationCategory.USER_TO_USER);
            assertThat(created.getSenderId()).isEqualTo("u1");
            verify(connectionRegistry).sendTo(eq("u2"), messageCaptor.capture());
            var frame = (OutboundMessage<?>) messageCaptor.getValue();
            assertThat(frame.getType()).isEqualTo("notification");
            assertThat(((NotificationMessageData) frame.getData()).getId()).isEqualTo(created.getId());
        }

        @Test
        @DisplayName("Should only store for an offline recipient")
        void shouldOnlyStoreForOfflineRecipient() {
            stubSaveAssigningIds();
            when(connectionRegistry.isConnected("u2")).thenReturn(false);

            notificationService.createUserNotification("u2", "u1", "Hi", "There", NotificationType.INFO, null);

            verify(connectionRegistry, never()).sendTo(anyString(), any());
        }

        @Test
        @DisplayName("Should not push a scheduled user notification")
        void shouldNotPushScheduled() {
            stubSaveAssigningIds();

            notificationService.createUserNotification("u2", "u1", "Hi", "There", NotificationType.INFO, NOW.plusSeconds(60));

            verifyNoInteractions(connectionRegistry);
        }
    }

    @Nested
    @DisplayName("publish Tests")
    class PublishTests {

        @Test
        @DisplayName("Should reject an unknown category")
        void shouldRejectUnknownCategory() {
            var request = CreateNotificationRequest.builder().category("broadcast").title("t").message("m").build();

            assertThatThrownBy(() -> notificationService.publish(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Invalid category. Must be \"system\" or \"user-to-user\"");
            verifyNoInteractions(notificationRepository);
        }

        @Test
        @DisplayName("Should require a recipient for user-to-user notifications")
        void shouldRequireRecipient() {
            var request = CreateNotificationRequest.builder().category("user-to-user").title("t").message("m").build();

            assertThatThrownBy(() -> notificationService.publish(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("userId");
        }

        @Test
        @DisplayName("Should create a single user-to-user notification")
        void shouldPublishUserNotification() {
            stubSaveAssigningIds();
            when(connectionRegistry.isConnected("u2")).thenReturn(false);
            var request = CreateNotificationRequest.builder()
                    .category("user-to-user").title("t").message("m").userId("u2").senderId("u1").build();

            var created = notificationService.publish(request);

            assertThat(created).singleElement().extracting(Notification::getUserId).isEqualTo("u2");
        }
    }

    @Nested
    @DisplayName("Read state Tests")
    class ReadStateTests {

        @Test
        @DisplayName("Should mark a notification as read")
        void shouldMarkRead() {
            var notification = unread("u1");
            when(notificationRepository.findById(notification.getId())).thenReturn(Optional.of(notification));
            when(notificationRepository.save(notification)).thenReturn(notification);

            var updated = notificationService.markRead(notification.getId());

            assertThat(updated.getRead()).isTrue();
        }

        @Test
        @DisplayName("Should fail for an unknown notification")
        void shouldFailForUnknownNotification() {
            var id = UUID.randomUUID();
            when(notificationRepository.findById(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> notificationService.markRead(id))
                    .isInstanceOf(NotificationNotFoundException.class)
                    .hasMessageContaining(id.toString());
        }

        @Test
        @DisplayName("Should return the number of notifications marked read")
        void shouldMarkAllRead() {
            when(notificationRepository.markAllRead("u1", NOW)).thenReturn(4);
            when(notificationRepository.findByUserIdAndReadFalseOrderByCreatedAtDesc("u1")).thenReturn(List.of());

            assertThat(notificationService.markAllRead("u1")).isEqualTo(4);
            assertThat(notificationService.getUnread("u1")).isEmpty();
        }

        @Test
        @DisplayName("Should group unread counts by user")
        void shouldGroupUnreadCounts() {
            when(notificationRepository.countUnreadByUser()).thenReturn(List.<Object[]>of(
                    new Object[]{"u1", 3L}, new Object[]{"u2", 1L}));

            assertThat(notificationService.findUsersWithUnread())
                    .containsEntry("u1", 3L)
                    .containsEntry("u2", 1L)
                    .hasSize(2);
        }
    }

    @Nested
    @DisplayName("Delivery Tests")
    class DeliveryTests {

        @Test
        @DisplayName("Should push every unread notification once on registration")
        void shouldDeliverAllUnread() {
            var unread = List.of(unread("u1"), unread("u1"), unread("u1"));
            when(notificationRepository.findByUserIdAndReadFalseOrderByCreatedAtDesc("u1")).thenReturn(unread);
            when(connectionRegistry.sendTo(eq("u1"), any())).thenReturn(true);

            var delivered = notificationService.deliverUnread("u1");

            assertThat(delivered).isEqualTo(3);
            verify(connectionRegistry, times(3)).sendTo(eq("u1"), messageCaptor.capture());
            assertThat(messageCaptor.getAllValues())
                    .extracting(frame -> ((NotificationMessageData) ((OutboundMessage<?>) frame).getData()).getId())
                    .containsExactlyInAnyOrderElementsOf(unread.stream().map(Notification::getId).toList());
        }

        @Test
        @DisplayName("Should read due notifications at the given instant")
        void shouldFlushScheduled() {
            var due = List.of(unread("u1"));
            when(notificationRepository.findDueScheduled(NOW)).thenReturn(due);

            assertThat(notificationService.flushScheduled(NOW)).isSameAs(due);
        }

        @Test
        @DisplayName("Should push job status to every admin")
        void shouldSendJobStatusToAdmins() {
            var jobId = UUID.randomUUID();
            when(userRepository.findByRole(UserRole.ADMIN)).thenReturn(List.of(user("a1", UserRole.ADMIN), user("a2", UserRole.ADMIN)));

            notificationService.sendJobStatusToAdmins(jobId, JobStatusEvent.STARTED, "started");

            verify(connectionRegistry).sendTo(eq("a1"), messageCaptor.capture());
            verify(connectionRegistry).sendTo(eq("a2"), any());
            var frame = (OutboundMessage<?>) messageCaptor.getValue();
            assertThat(frame.getType()).isEqualTo("cronjob_status");
            var data = (CronJobStatusData) frame.getData();
            assertThat(data.getCronJobId()).isEqualTo(jobId);
            assertThat(data.getStatus()).isEqualTo(JobStatusEvent.STARTED);
            assertThat(data.getTimestamp()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should swallow failures while notifying admins")
        void shouldSwallowAdminNotificationFailure() {
            when(userRepository.findByRole(UserRole.ADMIN)).thenThrow(new IllegalStateException("db down"));

            assertThatCode(() -> notificationService.sendJobStatusToAdmins(UUID.randomUUID(), JobStatusEvent.FAILED, "x"))
                    .doesNotThrowAnyException();
        }
    }
}

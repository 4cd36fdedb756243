package com.example.notificationscheduler.service.handler;

import com.example.notificationscheduler.domain.entity.Notification;
import com.example.notificationscheduler.domain.enums.NotificationType;
import com.example.notificationscheduler.service.NotificationService;
import com.example.notificationscheduler.service.handler.payload.CustomPayload;
import com.example.notificationscheduler.service.handler.payload.NotificationCheckPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationCheckHandler Tests")
class NotificationCheckHandlerTest {

    private static final Instant NOW = Instant.parse("2026-06-01T09:00:00Z");

    @Mock
    private NotificationService notificationService;

    private NotificationCheckHandler handler;

    @BeforeEach
    void setUp() {
        handler = new NotificationCheckHandler(notificationService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Notification scheduled(String userId) {
        return Notification.builder()
                .id(UUID.randomUUID())
                .userId(userId)
                .title("t")
                .message("m")
                .scheduledAt(NOW.minusSeconds(60))
                .build();
    }

    @Test
    @DisplayName("Should deliver due notifications and mark each one sent")
    void shouldFlushDueNotifications() {
        // Given
        var online = scheduled("u1");
        var offline = scheduled("u2");
        when(notificationService.flushScheduled(NOW)).thenReturn(List.of(online, offline));
        when(notificationService.deliver(online)).thenReturn(true);
        when(notificationService.deliver(offline)).thenReturn(false);

        // When
        var result = handler.execute(NotificationCheckPayload.EMPTY);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResponseData())
                .containsEntry("flushed", 2)
                .containsEntry("delivered", 1)
                .doesNotContainKey("broadcast");
        InOrder inOrder = inOrder(notificationService);
        inOrder.verify(notificationService).deliver(online);
        inOrder.verify(notificationService).markSent(online.getId());
        verify(notificationService).markSent(offline.getId());
        verify(notificationService, never()).createSystemNotification(anyString(), anyString(), any(), any());
    }

    @Test
    @DisplayName("Should broadcast the configured system notification")
    void shouldBroadcastConfiguredNotification() {
        when(notificationService.flushScheduled(NOW)).thenReturn(List.of());
        when(notificationService.createSystemNotification("Heads up", "Deploy at noon", NotificationType.WARNING, null))
                .thenReturn(List.of(scheduled("u1"), scheduled("u2")));
        var payload = NotificationCheckPayload.builder()
                .title("Heads up")
                .message("Deploy at noon")
                .type(NotificationType.WARNING)
                .build();

        var result = handler.execute(payload);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResponseData()).containsEntry("broadcast", 2);
    }

    @Test
    @DisplayName("Should still flush but skip the broadcast for unreadable job data")
    void shouldReportFormatError() {
        when(notificationService.flushScheduled(NOW)).thenReturn(List.of());

        var result = handler.execute(NotificationCheckPayload.invalid("Invalid JSON in jobData"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getNotes()).isEqualTo("Invalid JSON in jobData");
        verify(notificationService, never()).createSystemNotification(anyString(), anyString(), any(), any());
    }

    @Test
    @DisplayName("Should treat a foreign payload as empty")
    void shouldIgnoreForeignPayload() {
        when(notificationService.flushScheduled(NOW)).thenReturn(List.of());

        var result = handler.execute(CustomPayload.EMPTY);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getNotes()).isNull();
    }

    @Test
    @DisplayName("Should return a failure when the store is unavailable")
    void shouldReturnFailureOnException() {
        when(notificationService.flushScheduled(NOW)).thenThrow(new IllegalStateException("connection refused"));

        var result = handler.execute(NotificationCheckPayload.EMPTY);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).isEqualTo("connection refused");
        assertThat(result.getErrorType()).isEqualTo("IllegalStateException");
    }
}

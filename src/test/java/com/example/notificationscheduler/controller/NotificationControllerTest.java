package com.example.notificationscheduler.controller;

import com.example.notificationscheduler.domain.entity.Notification;
import com.example.notificationscheduler.domain.enums.NotificationCategory;
import com.example.notificationscheduler.dto.CreateNotificationRequest;
import com.example.notificationscheduler.dto.NotificationResponse;
import com.example.notificationscheduler.exception.NotificationNotFoundException;
import com.example.notificationscheduler.mapper.NotificationMapper;
import com.example.notificationscheduler.service.NotificationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({NotificationController.class, PingController.class})
@DisplayName("NotificationController Tests")
class NotificationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private NotificationService notificationService;

    @MockBean
    private NotificationMapper notificationMapper;

    private NotificationResponse response(String userId) {
        return NotificationResponse.builder()
                .id(UUID.randomUUID())
                .userId(userId)
                .title("Maintenance")
                .message("Tonight")
                .category(NotificationCategory.SYSTEM)
                .read(false)
                .sent(false)
                .build();
    }

    @Test
    @DisplayName("Should create notifications and report how many")
    void shouldCreateNotifications() throws Exception {
        var stored = List.of(new Notification(), new Notification());
        when(notificationService.publish(any(CreateNotificationRequest.class))).thenReturn(stored);
        when(notificationMapper.toResponseList(stored)).thenReturn(List.of(response("u1"), response("u2")));

        mockMvc.perform(post("/api/notifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"system\",\"title\":\"Maintenance\",\"message\":\"Tonight\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Created 2 notifications"))
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].category").value("system"))
                .andExpect(jsonPath("$.data[0].isRead").value(false));
    }

    @Test
    @DisplayName("Should map an unknown category to 400")
    void shouldRejectUnknownCategory() throws Exception {
        when(notificationService.publish(any(CreateNotificationRequest.class)))
                .thenThrow(new IllegalArgumentException("Invalid category. Must be \"system\" or \"user-to-user\""));

        mockMvc.perform(post("/api/notifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"everyone\",\"title\":\"t\",\"message\":\"m\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid category. Must be \"system\" or \"user-to-user\""));
    }

    @Test
    @DisplayName("Should reject a notification without a title")
    void shouldRejectMissingTitle() throws Exception {
        mockMvc.perform(post("/api/notifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"system\",\"message\":\"m\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"));

        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("Should list unread notifications of a user")
    void shouldListUnread() throws Exception {
        when(notificationService.getUnread("u1")).thenReturn(List.of());
        when(notificationMapper.toResponseList(anyList())).thenReturn(List.of(response("u1")));

        mockMvc.perform(get("/api/notifications/{userId}", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].userId").value("u1"));
    }

    @Test
    @DisplayName("Should return 404 when marking an unknown notification")
    void shouldReturnNotFoundOnMarkRead() throws Exception {
        var id = UUID.randomUUID();
        when(notificationService.markRead(id)).thenThrow(new NotificationNotFoundException(id));

        mockMvc.perform(put("/api/notifications/{id}/read", id))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should return the number of notifications marked read")
    void shouldMarkAllRead() throws Exception {
        when(notificationService.markAllRead("u1")).thenReturn(3);

        mockMvc.perform(post("/api/notifications/mark-all-read/{userId}", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(3))
                .andExpect(jsonPath("$.message").value("Marked 3 notifications as read"));
    }

    @Test
    @DisplayName("Should answer the liveness check")
    void shouldAnswerPing() throws Exception {
        mockMvc.perform(get("/ping"))
                .andExpect(status().isOk())
                .andExpect(content().string("pong"));
    }
}

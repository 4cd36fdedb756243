package com.example.notificationscheduler.controller;

import com.example.notificationscheduler.dto.ApiResponse;
import com.example.notificationscheduler.dto.CreateNotificationRequest;
import com.example.notificationscheduler.dto.NotificationResponse;
import com.example.notificationscheduler.mapper.NotificationMapper;
import com.example.notificationscheduler.service.NotificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for notifications.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/notifications")
@Tag(name = "Notifications", description = "APIs for creating and reading notifications")
public class NotificationController {

    private final NotificationService notificationService;
    private final NotificationMapper notificationMapper;

    @PostMapping
    @Operation(summary = "Create notifications",
            description = "A system notification creates one record per user; a user-to-user notification creates one record")
    public ResponseEntity<ApiResponse<List<NotificationResponse>>> create(@Valid @RequestBody CreateNotificationRequest request) {
        log.info("API: Create {} notification '{}'", request.getCategory(), request.getTitle());

        var created = notificationMapper.toResponseList(notificationService.publish(request));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, String.format("Created %d notifications", created.size())));
    }

    @GetMapping("/{userId}")
    @Operation(summary = "Get unread notifications", description = "Unread notifications of a user, newest first")
    public ResponseEntity<ApiResponse<List<NotificationResponse>>> getUnread(@Parameter(description = "User ID") @PathVariable String userId) {
        return ResponseEntity.ok(ApiResponse.success(notificationMapper.toResponseList(notificationService.getUnread(userId))));
    }

    @PutMapping("/{id}/read")
    @Operation(summary = "Mark a notification as read")
    public ResponseEntity<ApiResponse<NotificationResponse>> markRead(@Parameter(description = "Notification UUID") @PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(notificationMapper.toResponse(notificationService.markRead(id))));
    }

    @PostMapping("/mark-all-read/{userId}")
    @Operation(summary = "Mark all notifications of a user as read")
    public ResponseEntity<ApiResponse<Integer>> markAllRead(@Parameter(description = "User ID") @PathVariable String userId) {
        var count = notificationService.markAllRead(userId);
        return ResponseEntity.ok(ApiResponse.success(count, String.format("Marked %d notifications as read", count)));
    }
}

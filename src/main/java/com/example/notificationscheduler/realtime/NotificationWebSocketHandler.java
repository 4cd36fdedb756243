package com.example.notificationscheduler.realtime;

import com.example.notificationscheduler.exception.NotificationNotFoundException;
import com.example.notificationscheduler.realtime.message.InboundMessage;
import com.example.notificationscheduler.service.NotificationService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.UUID;

/**
 * WebSocket handler for the notification channel. Handles JSON messages:
 * {@code {"type":"register","userId":"..."}} and {@code {"type":"markAsRead","notificationId":"..."}}.
 * <p>
 * Anything else is logged and dropped; the session is never closed by the server.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationWebSocketHandler extends TextWebSocketHandler {

    private final ConnectionRegistry connectionRegistry;
    private final NotificationService notificationService;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.debug("[WebSocket] Connection established: session={}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage textMessage) {
        InboundMessage message;
        try {
            message = objectMapper.readValue(textMessage.getPayload(), InboundMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("[WebSocket] Dropping unparseable message on session {}: {}", session.getId(), e.getOriginalMessage());
            return;
        }

        if (message == null || message.getType() == null) {
            log.warn("[WebSocket] Dropping message without type on session {}", session.getId());
            return;
        }

        try {
            switch (message.getType()) {
                case InboundMessage.REGISTER:
                    handleRegister(session, message);
                    break;
                case InboundMessage.MARK_AS_READ:
                    handleMarkAsRead(session, message);
                    break;
                default:
                    log.warn("[WebSocket] Dropping message of unknown type '{}' on session {}", message.getType(), session.getId());
            }
        } catch (Exception e) {
            log.error("[WebSocket] Failed to handle '{}' message on session {}: {}", message.getType(), session.getId(), e.getMessage(), e);
        }
    }

    private void handleRegister(WebSocketSession session, InboundMessage message) {
        var userId = message.getUserId();
        if (userId == null || userId.isBlank()) {
            log.warn("[WebSocket] Dropping register message without userId on session {}", session.getId());
            return;
        }

        connectionRegistry.register(userId, session);
        notificationService.deliverUnread(userId);
    }

    private void handleMarkAsRead(WebSocketSession session, InboundMessage message) {
        UUID notificationId;
        try {
            notificationId = UUID.fromString(String.valueOf(message.getNotificationId()));
        } catch (IllegalArgumentException e) {
            log.warn("[WebSocket] Dropping markAsRead message with invalid notificationId '{}' on session {}",
                    message.getNotificationId(), session.getId());
            return;
        }

        try {
            notificationService.markRead(notificationId);
        } catch (NotificationNotFoundException e) {
            log.warn("[WebSocket] {}", e.getMessage());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WebSocket] Transport error on session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("[WebSocket] Connection closed: session={}, status={}", session.getId(), status);
        connectionRegistry.findUserByConnection(session)
                .ifPresent(userId -> connectionRegistry.unregister(userId, session));
    }
}

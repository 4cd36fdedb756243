package com.example.notificationscheduler.realtime;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.service.UserPresenceService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes outbound messages to the single live session of each user.
 * <p>
 * A later registration for the same user replaces the mapping but does not close the
 * superseded session. Online flag updates are best effort: a failing store never
 * blocks registration or routing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    private final UserPresenceService userPresenceService;
    private final ObjectMapper objectMapper;
    private final MetricsConfig metricsConfig;

    public void register(String userId, WebSocketSession session) {
        var previous = sessions.put(userId, session);
        if (previous != null && previous != session) {
            log.warn("User {} registered session {} while session {} was still mapped; previous session left open",
                    userId, session.getId(), previous.getId());
        }
        log.info("User {} connected (session {})", userId, session.getId());
        metricsConfig.updateConnectedSessions(sessions.size());

        try {
            userPresenceService.markOnline(userId);
        } catch (Exception e) {
            log.warn("Failed to mark user {} online: {}", userId, e.getMessage());
        }
    }

    public void unregister(String userId) {
        var removed = sessions.remove(userId);
        if (removed != null) {
            onDisconnected(userId, removed);
        }
    }

    /**
     * Remove the mapping only while it still points at this session, so closing a
     * superseded session never drops the user's newer one
     *
     * @return true when the mapping was removed
     */
    public boolean unregister(String userId, WebSocketSession session) {
        if (!sessions.remove(userId, session)) {
            log.debug("Session {} of user {} is no longer mapped, keeping current session", session.getId(), userId);
            return false;
        }
        onDisconnected(userId, session);
        return true;
    }

    private void onDisconnected(String userId, WebSocketSession session) {
        log.info("User {} disconnected (session {})", userId, session.getId());
        metricsConfig.updateConnectedSessions(sessions.size());

        try {
            userPresenceService.markOffline(userId);
        } catch (Exception e) {
            log.warn("Failed to mark user {} offline: {}", userId, e.getMessage());
        }
    }

    /**
     * Serialize and push a message to the user's session, if it is connected and open
     *
     * @return true when the frame was written
     */
    public boolean sendTo(String userId, Object message) {
        var session = sessions.get(userId);
        if (session == null || !session.isOpen()) {
            return false;
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize message for user {}: {}", userId, e.getMessage());
            return false;
        }

        // Spring WebSocket sessions do not allow concurrent sends
        synchronized (session) {
            try {
                session.sendMessage(new TextMessage(payload));
                return true;
            } catch (IOException | IllegalStateException e) {
                log.warn("Failed to send message to user {}: {}", userId, e.getMessage());
                return false;
            }
        }
    }

    /**
     * Reverse lookup by session identity
     */
    public Optional<String> findUserByConnection(WebSocketSession session) {
        return sessions.entrySet().stream()
                .filter(entry -> entry.getValue() == session)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public boolean isConnected(String userId) {
        var session = sessions.get(userId);
        return session != null && session.isOpen();
    }

    public Set<String> connectedUserIds() {
        return Set.copyOf(sessions.keySet());
    }

    public int connectionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Dropping {} realtime sessions", sessions.size());
        sessions.clear();
        metricsConfig.updateConnectedSessions(0);
    }
}

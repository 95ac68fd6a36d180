package com.insightops.dashboard.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.insightops.dashboard.config.DashboardProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Pushes the {@link StatusSnapshot} to every connected dashboard client.
 *
 * <p>On connection, starts a push loop (every {@code dashboard.status-push-seconds})
 * for that session. A client may send {@code refresh} to get a snapshot immediately.
 * On disconnection or transport error the session's loop is cancelled.</p>
 */
@Slf4j
@Component
public class StatusWebSocketHandler extends TextWebSocketHandler {

    private final PollingStatusService pollingStatusService;
    private final DashboardProperties properties;
    private final ObjectMapper objectMapper;

    /** Tracks active push tasks per session so they can be cancelled on disconnect. */
    private final Map<String, ScheduledFuture<?>> scheduledTasks = new ConcurrentHashMap<>();

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2);

    public StatusWebSocketHandler(PollingStatusService pollingStatusService,
                                  DashboardProperties properties,
                                  ObjectMapper objectMapper) {
        this.pollingStatusService = pollingStatusService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("WebSocket connected: sessionId={}", session.getId());
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(
                () -> pushStatus(session),
                0, properties.getStatusPushSeconds(), TimeUnit.SECONDS
        );
        scheduledTasks.put(session.getId(), future);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Received message from session {}: {}", session.getId(), message.getPayload());
        if ("refresh".equalsIgnoreCase(message.getPayload().trim())) {
            pushStatus(session);
        } else {
            sendMessage(session, "{\"type\":\"ack\",\"message\":\"received\"}");
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("WebSocket disconnected: sessionId={}, status={}", session.getId(), status);
        cleanup(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("WebSocket transport error for session {}: {}", session.getId(), exception.getMessage());
        cleanup(session.getId());
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    /** Number of sessions with an active push loop. */
    public int activeSessions() {
        return scheduledTasks.size();
    }

    private void pushStatus(WebSocketSession session) {
        if (!session.isOpen()) {
            cleanup(session.getId());
            return;
        }
        try {
            sendMessage(session, buildPayload(pollingStatusService.snapshot()));
        } catch (RuntimeException e) {
            log.warn("Failed to push status to session {}: {}", session.getId(), e.getMessage());
        }
    }

    /**
     * Wraps the snapshot in a {@code {"type":"status","data":...}} envelope.
     */
    String buildPayload(StatusSnapshot snapshot) {
        try {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("type", "status");
            node.put("timestamp", snapshot.getTimestamp().toEpochMilli());
            node.set("data", objectMapper.valueToTree(snapshot));
            return objectMapper.writeValueAsString(node);
        } catch (Exception e) {
            log.error("Failed to build status payload", e);
            return "{\"type\":\"error\",\"message\":\"status unavailable\"}";
        }
    }

    /**
     * Sends a text message to the WebSocket session, handling errors gracefully.
     */
    private void sendMessage(WebSocketSession session, String payload) {
        if (session.isOpen()) {
            try {
                synchronized (session) {
                    session.sendMessage(new TextMessage(payload));
                }
            } catch (IOException e) {
                log.error("Failed to send message to session {}: {}", session.getId(), e.getMessage());
            }
        }
    }

    private void cleanup(String sessionId) {
        ScheduledFuture<?> future = scheduledTasks.remove(sessionId);
        if (future != null) {
            future.cancel(true);
            log.debug("Cancelled status push for session {}", sessionId);
        }
    }
}

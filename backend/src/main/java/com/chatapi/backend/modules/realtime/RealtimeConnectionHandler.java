package com.chatapi.backend.modules.realtime;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.chatapi.backend.global.security.AuthenticatedUser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * 인증된 실시간 연결을 사용자별로 관리한다. 방/메시지 이벤트는 다루지 않는다.
 */
@Component
public class RealtimeConnectionHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RealtimeConnectionHandler.class);

    private final Map<UUID, Set<WebSocketSession>> connections = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public RealtimeConnectionHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        AuthenticatedUser user = authenticatedUser(session);
        if (user == null) {
            // only reachable if the handshake interceptor was bypassed
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        connections.computeIfAbsent(user.userId(), id -> ConcurrentHashMap.newKeySet()).add(session);
        log.info("User {} connected ({})", user.userId(), session.getId());
        send(session, Map.of("type", "connected", "userId", user.userId().toString()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        String type;
        try {
            JsonNode payload = objectMapper.readTree(message.getPayload());
            type = payload.path("type").asText("");
        } catch (JsonProcessingException ex) {
            log.debug("Malformed frame on {}: {}", session.getId(), ex.getOriginalMessage());
            send(session, Map.of("type", "error", "message", "Malformed message"));
            return;
        }

        if ("ping".equals(type)) {
            send(session, Map.of("type", "pong"));
        } else {
            send(session, Map.of("type", "error", "message", "Unsupported message type"));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        AuthenticatedUser user = authenticatedUser(session);
        if (user == null) {
            return;
        }
        connections.computeIfPresent(user.userId(), (id, sessions) -> {
            sessions.remove(session);
            return sessions.isEmpty() ? null : sessions;
        });
        log.info("User {} disconnected ({}, {})", user.userId(), session.getId(), status.getCode());
    }

    public int connectionCount(UUID userId) {
        Set<WebSocketSession> sessions = connections.get(userId);
        return sessions == null ? 0 : sessions.size();
    }

    private void send(WebSocketSession session, Map<String, String> event) throws IOException {
        // WebSocketSession.sendMessage is not safe for concurrent senders
        synchronized (session) {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
        }
    }

    private static AuthenticatedUser authenticatedUser(WebSocketSession session) {
        Object attribute = session.getAttributes().get(AccessTokenHandshakeInterceptor.AUTHENTICATED_USER_ATTRIBUTE);
        return attribute instanceof AuthenticatedUser user ? user : null;
    }
}

package com.chatapi.backend.modules.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import com.chatapi.backend.global.security.AuthenticatedUser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

class RealtimeConnectionHandlerTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000301");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RealtimeConnectionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new RealtimeConnectionHandler(objectMapper);
    }

    @Test
    void greetsAndTracksAuthenticatedConnection() throws Exception {
        RecordingSession session = new RecordingSession("s1", new AuthenticatedUser(USER_ID, "f@x.com", "f", null));

        handler.afterConnectionEstablished(session.mock);

        assertThat(handler.connectionCount(USER_ID)).isEqualTo(1);
        JsonNode greeting = objectMapper.readTree(session.sent.get(0));
        assertThat(greeting.path("type").asText()).isEqualTo("connected");
        assertThat(greeting.path("userId").asText()).isEqualTo(USER_ID.toString());
    }

    @Test
    void answersPingWithPong() throws Exception {
        RecordingSession session = new RecordingSession("s1", new AuthenticatedUser(USER_ID, "f@x.com", "f", null));
        handler.afterConnectionEstablished(session.mock);

        handler.handleMessage(session.mock, new TextMessage("{\"type\":\"ping\"}"));
        handler.handleMessage(session.mock, new TextMessage("not json"));

        assertThat(objectMapper.readTree(session.sent.get(1)).path("type").asText()).isEqualTo("pong");
        assertThat(objectMapper.readTree(session.sent.get(2)).path("type").asText()).isEqualTo("error");
    }

    @Test
    void closingRemovesConnection() throws Exception {
        AuthenticatedUser user = new AuthenticatedUser(USER_ID, "f@x.com", "f", null);
        RecordingSession first = new RecordingSession("s1", user);
        RecordingSession second = new RecordingSession("s2", user);
        handler.afterConnectionEstablished(first.mock);
        handler.afterConnectionEstablished(second.mock);

        handler.afterConnectionClosed(first.mock, CloseStatus.NORMAL);
        assertThat(handler.connectionCount(USER_ID)).isEqualTo(1);

        handler.afterConnectionClosed(second.mock, CloseStatus.NORMAL);
        assertThat(handler.connectionCount(USER_ID)).isZero();
    }

    @Test
    void sessionWithoutPrincipalIsClosed() throws Exception {
        RecordingSession session = new RecordingSession("s1", null);

        handler.afterConnectionEstablished(session.mock);

        verify(session.mock).close(CloseStatus.POLICY_VIOLATION);
        assertThat(session.sent).isEmpty();
    }

    private static final class RecordingSession {

        private final WebSocketSession mock = mock(WebSocketSession.class);
        private final List<String> sent = new CopyOnWriteArrayList<>();

        RecordingSession(String id, AuthenticatedUser user) throws Exception {
            Map<String, Object> attributes = new HashMap<>();
            if (user != null) {
                attributes.put(AccessTokenHandshakeInterceptor.AUTHENTICATED_USER_ATTRIBUTE, user);
            }
            when(mock.getId()).thenReturn(id);
            when(mock.getAttributes()).thenReturn(attributes);
            when(mock.isOpen()).thenReturn(true);
            doAnswer(invocation -> {
                WebSocketMessage<?> message = invocation.getArgument(0);
                sent.add((String) message.getPayload());
                return null;
            }).when(mock).sendMessage(any());
        }
    }
}

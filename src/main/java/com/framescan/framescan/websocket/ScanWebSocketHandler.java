package com.framescan.framescan.websocket;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.framescan.framescan.service.session.SessionProtocol;

/**
 * Binds {@code /ws/{sessionId}} WebSocket connections to the session protocol.
 */
@Component
public class ScanWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(ScanWebSocketHandler.class);
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final SessionProtocol protocol;
    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketSessionConnection> connections = new ConcurrentHashMap<>();

    public ScanWebSocketHandler(SessionProtocol protocol, ObjectMapper objectMapper) {
        this.protocol = protocol;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSessionConnection connection = new WebSocketSessionConnection(
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT),
                objectMapper);
        connections.put(session.getId(), connection);
        String sessionId = sessionIdOf(session);
        logger.info("WebSocket {} opened for session {}", session.getId(), sessionId);
        protocol.onOpen(sessionId, connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSessionConnection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }
        protocol.onMessage(sessionIdOf(session), connection, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("WebSocket {} transport error: {}", session.getId(), exception.getMessage());
        WebSocketSessionConnection connection = connections.get(session.getId());
        if (connection != null) {
            connection.close();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketSessionConnection connection = connections.remove(session.getId());
        logger.info("WebSocket {} closed ({})", session.getId(), status);
        if (connection != null) {
            protocol.onClose(sessionIdOf(session), connection);
        }
    }

    static String sessionIdOf(WebSocketSession session) {
        URI uri = session.getUri();
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }
}

package com.framescan.framescan.websocket;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.framescan.framescan.model.dto.SessionEvent;
import com.framescan.framescan.service.session.SessionConnection;

/**
 * {@link SessionConnection} over a Spring {@link WebSocketSession}. The wrapped
 * session must tolerate concurrent sends (see
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}).
 */
class WebSocketSessionConnection implements SessionConnection {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketSessionConnection.class);

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    WebSocketSessionConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(SessionEvent event) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            logger.warn("Error closing WebSocket {}: {}", session.getId(), e.getMessage());
        }
    }
}

package com.framescan.framescan.service.session;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.framescan.framescan.model.dto.SessionEvent;

/**
 * Fire-and-forget delivery to a session's bound connection. A failed delivery
 * counts as a disconnect and tears the session down.
 */
@Component
public class SessionEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(SessionEventPublisher.class);

    private final SessionRegistry registry;

    public SessionEventPublisher(SessionRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return true if the event was handed to the transport
     */
    public boolean publish(ScanSession session, SessionEvent event) {
        SessionConnection connection = session.getConnection();
        if (connection == null || !connection.isOpen()) {
            logger.debug("Session {}: no open connection, dropping {}", session.getId(), event.getType());
            return false;
        }
        return deliver(session.getId(), connection, event);
    }

    /**
     * Deliver to a specific connection, which need not be bound to the session.
     */
    public boolean deliver(String sessionId, SessionConnection connection, SessionEvent event) {
        try {
            connection.send(event);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.warn("Session {}: delivery of {} to {} failed, treating as disconnect: {}",
                    sessionId, event.getType(), connection.id(), e.getMessage());
            connection.close();
            if (registry.find(sessionId).map(s -> s.isBoundTo(connection)).orElse(false)) {
                registry.remove(sessionId);
            }
            return false;
        }
    }
}

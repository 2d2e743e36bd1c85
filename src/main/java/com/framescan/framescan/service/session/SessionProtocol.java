package com.framescan.framescan.service.session;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.framescan.framescan.config.ScanProperties;
import com.framescan.framescan.exception.SessionError;
import com.framescan.framescan.exception.SessionException;
import com.framescan.framescan.model.ClassificationResult;
import com.framescan.framescan.model.VideoProperties;
import com.framescan.framescan.model.dto.ClassificationEvent;
import com.framescan.framescan.model.dto.ConnectionEstablishedEvent;
import com.framescan.framescan.model.dto.ErrorEvent;
import com.framescan.framescan.model.dto.InboundMessage;
import com.framescan.framescan.model.dto.PingEvent;
import com.framescan.framescan.model.dto.VideoInfoEvent;
import com.framescan.framescan.service.classifier.ClassifierBootstrap;

/**
 * Connection lifecycle for a session: accept, attach, stream, close.
 * <p>
 * Transport adapters call {@link #onOpen}, {@link #onMessage} and
 * {@link #onClose}; the keepalive sweep calls {@link #sendKeepaliveIfIdle}.
 * Closing the bound connection always tears the session down, whether or not
 * attach succeeded.
 */
@Service
public class SessionProtocol {

    private static final Logger logger = LoggerFactory.getLogger(SessionProtocol.class);

    private final SessionRegistry registry;
    private final FrameClassificationService classificationService;
    private final StreamingCoordinator coordinator;
    private final SessionEventPublisher publisher;
    private final ClassifierBootstrap classifierBootstrap;
    private final ObjectMapper objectMapper;
    private final Executor coordinatorExecutor;
    private final Executor frameRequestExecutor;
    private final long idleTimeoutMillis;

    public SessionProtocol(SessionRegistry registry,
                           FrameClassificationService classificationService,
                           StreamingCoordinator coordinator,
                           SessionEventPublisher publisher,
                           ClassifierBootstrap classifierBootstrap,
                           ObjectMapper objectMapper,
                           @Qualifier("coordinatorExecutor") Executor coordinatorExecutor,
                           @Qualifier("frameRequestExecutor") Executor frameRequestExecutor,
                           ScanProperties properties) {
        this.registry = registry;
        this.classificationService = classificationService;
        this.coordinator = coordinator;
        this.publisher = publisher;
        this.classifierBootstrap = classifierBootstrap;
        this.objectMapper = objectMapper;
        this.coordinatorExecutor = coordinatorExecutor;
        this.frameRequestExecutor = frameRequestExecutor;
        this.idleTimeoutMillis = properties.getScan().idleTimeout().toMillis();
    }

    public void onOpen(String sessionId, SessionConnection connection) {
        if (registry.find(sessionId).isEmpty()) {
            logger.warn("Connection {} for unknown session {}", connection.id(), sessionId);
            publisher.deliver(sessionId, connection, new ErrorEvent("Session not found"));
            connection.close();
            return;
        }

        if (!registry.bindConnection(sessionId, connection)) {
            publisher.deliver(sessionId, connection,
                    new ErrorEvent("Session already has an active connection"));
            connection.close();
            return;
        }

        Optional<ScanSession> bound = registry.find(sessionId);
        if (bound.isEmpty() || bound.get().isClosing()) {
            logger.info("Session {} removed while connection {} was binding", sessionId, connection.id());
            connection.close();
            return;
        }
        ScanSession session = bound.get();
        if (!publisher.publish(session, new ConnectionEstablishedEvent(sessionId))) {
            return;
        }

        registry.updatePhase(sessionId, SessionPhase.ATTACHING);
        try {
            attach(session);
        } catch (SessionException e) {
            failAttach(session, connection, e.getMessage());
            return;
        } catch (RejectedExecutionException e) {
            logger.error("Session {}: no capacity for another coordinator", sessionId);
            failAttach(session, connection, "Server is busy, try again later");
            return;
        }
        registry.updatePhase(sessionId, SessionPhase.STREAMING);
    }

    private void attach(ScanSession session) {
        classifierBootstrap.requireClassifier();

        Path videoPath = session.getVideoPath();
        if (videoPath == null || !Files.isRegularFile(videoPath)) {
            throw new SessionException(SessionError.VIDEO_NOT_FOUND, "Video file not found");
        }

        VideoProperties properties = registry.attach(session.getId(), videoPath);
        if (!publisher.publish(session, new VideoInfoEvent(properties))) {
            return;
        }

        CoordinatorTask task = coordinator.newTask(session);
        registry.startCoordinator(session.getId(), task, coordinatorExecutor);
    }

    private void failAttach(ScanSession session, SessionConnection connection, String message) {
        logger.warn("Session {}: attach failed: {}", session.getId(), message);
        publisher.publish(session, new ErrorEvent(message));
        connection.close();
        registry.remove(session.getId());
    }

    public void onMessage(String sessionId, SessionConnection connection, String payload) {
        Optional<ScanSession> found = registry.find(sessionId);
        if (found.isEmpty() || !found.get().isBoundTo(connection)) {
            logger.debug("Ignoring message from {} for session {}: not the bound connection",
                    connection.id(), sessionId);
            return;
        }
        ScanSession session = found.get();
        session.markActivity(System.currentTimeMillis());

        InboundMessage message;
        try {
            message = objectMapper.readValue(payload, InboundMessage.class);
        } catch (JsonProcessingException e) {
            logger.warn("Session {}: malformed message ignored: {}", sessionId, e.getOriginalMessage());
            return;
        }
        if (message == null) {
            logger.warn("Session {}: empty message ignored", sessionId);
            return;
        }

        String type = message.getType();
        if (InboundMessage.PROCESS_FRAME.equals(type)) {
            handleFrameRequest(session, message);
        } else if (InboundMessage.CONNECT.equals(type) || InboundMessage.PONG.equals(type)) {
            logger.debug("Session {}: {} acknowledged", sessionId, type);
        } else {
            logger.info("Session {}: unrecognized message type '{}' ignored", sessionId, type);
        }
    }

    private void handleFrameRequest(ScanSession session, InboundMessage message) {
        Double timestamp = message.getTimestamp();
        if (timestamp == null || timestamp.isNaN() || timestamp.isInfinite()) {
            logger.warn("Session {}: process_frame without a usable timestamp ignored", session.getId());
            return;
        }
        if (session.getPhase() != SessionPhase.STREAMING) {
            logger.debug("Session {}: process_frame before streaming started ignored", session.getId());
            return;
        }

        try {
            frameRequestExecutor.execute(() -> processFrame(session, timestamp));
        } catch (RejectedExecutionException e) {
            logger.warn("Session {}: frame request at {}s rejected, queue full", session.getId(), timestamp);
            publisher.publish(session, new ErrorEvent("Too many pending frame requests"));
        }
    }

    void processFrame(ScanSession session, double timestamp) {
        try {
            Optional<ClassificationResult> result = classificationService.classifyAt(session, timestamp);
            result.ifPresent(r -> publisher.publish(session, new ClassificationEvent(r)));
        } catch (SessionException e) {
            if (session.isClosing()) {
                logger.debug("Session {}: frame request at {}s dropped during teardown", session.getId(), timestamp);
                return;
            }
            logger.warn("Session {}: frame request at {}s failed: {}", session.getId(), timestamp, e.getMessage());
            publisher.publish(session, new ErrorEvent(e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Session {}: unexpected error on frame request at {}s", session.getId(), timestamp, e);
            publisher.publish(session, new ErrorEvent("Processing error at " + timestamp + "s"));
        }
    }

    public void onClose(String sessionId, SessionConnection connection) {
        Optional<ScanSession> found = registry.find(sessionId);
        if (found.isEmpty()) {
            return;
        }
        ScanSession session = found.get();
        SessionConnection bound = session.getConnection();
        if (bound != null && bound != connection) {
            // A rejected second connection going away; the session belongs to the first one
            logger.debug("Connection {} closed, session {} stays with {}", connection.id(), sessionId, bound.id());
            return;
        }
        logger.info("Connection {} closed, tearing down session {}", connection.id(), sessionId);
        registry.remove(sessionId);
    }

    /**
     * Ping the client if nothing has arrived for the idle timeout. The deadline
     * restarts after each ping; nothing is cancelled.
     */
    public void sendKeepaliveIfIdle(ScanSession session, long nowMillis) {
        if (session.isClosing() || !session.hasOpenConnection()) {
            return;
        }
        if (nowMillis - session.getLastActivityAt() < idleTimeoutMillis) {
            return;
        }
        session.markActivity(nowMillis);
        logger.debug("Session {}: idle for {}ms, sending ping", session.getId(), idleTimeoutMillis);
        publisher.publish(session, new PingEvent());
    }
}

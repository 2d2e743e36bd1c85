package com.framescan.framescan.service.session;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.framescan.framescan.config.ScanProperties;
import com.framescan.framescan.exception.SessionError;
import com.framescan.framescan.exception.SessionException;
import com.framescan.framescan.exception.VideoAccessException;
import com.framescan.framescan.model.VideoProperties;
import com.framescan.framescan.service.video.VideoSource;
import com.framescan.framescan.service.video.VideoSourceFactory;

/**
 * The live sessions of this process, keyed by session id.
 * <p>
 * The map itself is the only cross-session state. Everything else is guarded
 * per entry: resource fields under the {@link ScanSession} monitor, decoding
 * under the session's cursor lock. No decode or file I/O runs while holding
 * either the map or a session monitor.
 */
@Component
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, ScanSession> sessions = new ConcurrentHashMap<>();

    private final VideoSourceFactory videoSourceFactory;
    private final SessionResourceManager resourceManager;
    private final ScanProperties properties;

    public SessionRegistry(VideoSourceFactory videoSourceFactory, SessionResourceManager resourceManager,
            ScanProperties properties) {
        this.videoSourceFactory = videoSourceFactory;
        this.resourceManager = resourceManager;
        this.properties = properties;
    }

    public String create() {
        String id = UUID.randomUUID().toString();
        sessions.put(id, new ScanSession(id));
        logger.info("Session {} created ({} active)", id, sessions.size());
        return id;
    }

    /**
     * Record where a provisioned video lives, so attach can find it and teardown can delete it.
     */
    public void assignVideo(String sessionId, Path videoPath) {
        ScanSession session = require(sessionId);
        synchronized (session) {
            session.setVideoPath(videoPath);
        }
    }

    public Optional<ScanSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public ScanSession require(String sessionId) {
        return find(sessionId)
                .orElseThrow(() -> new SessionException(SessionError.SESSION_NOT_FOUND,
                        "Session not found: " + sessionId));
    }

    public List<ScanSession> activeSessions() {
        return new ArrayList<>(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Open the session's video, verify a first frame decodes, and store the
     * handle with its properties. The cursor is left at frame 0. A session that
     * is already attached keeps its existing handle.
     *
     * @throws SessionException VIDEO_UNREADABLE, EMPTY_VIDEO or SESSION_NOT_FOUND
     */
    public VideoProperties attach(String sessionId, Path videoPath) {
        ScanSession session = require(sessionId);
        synchronized (session) {
            if (session.isClosing()) {
                throw new SessionException(SessionError.SESSION_NOT_FOUND, "Session is closing: " + sessionId);
            }
            if (session.getVideoSource() != null) {
                logger.warn("Session {} already attached, keeping existing video handle", sessionId);
                return session.getProperties();
            }
        }

        VideoSource source;
        try {
            source = videoSourceFactory.open(videoPath);
        } catch (VideoAccessException e) {
            logger.warn("Session {}: could not open {}: {}", sessionId, videoPath, e.getMessage());
            throw new SessionException(SessionError.VIDEO_UNREADABLE, "Could not open video file", e);
        }

        try {
            source.seekToFrame(0);
            BufferedImage first = source.readFrame();
            if (first == null) {
                throw new SessionException(SessionError.EMPTY_VIDEO, "Video contains no readable frames");
            }
            source.seekToFrame(0);
        } catch (VideoAccessException e) {
            source.close();
            throw new SessionException(SessionError.EMPTY_VIDEO, "Video contains no readable frames", e);
        } catch (RuntimeException e) {
            source.close();
            throw e;
        }

        VideoProperties videoProperties = source.properties();
        synchronized (session) {
            if (session.isClosing() || session.getVideoSource() != null) {
                // Lost a race with teardown or with a concurrent attach
                source.close();
                if (session.isClosing()) {
                    throw new SessionException(SessionError.SESSION_NOT_FOUND, "Session is closing: " + sessionId);
                }
                return session.getProperties();
            }
            session.setVideoSource(source);
            session.setProperties(videoProperties);
            session.setVideoPath(videoPath);
        }

        logger.info("Session {} attached: {}fps, {} frames, {}x{}, {}s", sessionId,
                videoProperties.getFrameRate(), videoProperties.getTotalFrames(),
                videoProperties.getWidth(), videoProperties.getHeight(), videoProperties.getDuration());
        return videoProperties;
    }

    /**
     * @return false if the session is unknown, closing, or already has a connection
     */
    public boolean bindConnection(String sessionId, SessionConnection connection) {
        Optional<ScanSession> found = find(sessionId);
        if (found.isEmpty()) {
            logger.warn("Cannot bind connection {}: session {} not found", connection.id(), sessionId);
            return false;
        }
        ScanSession session = found.get();
        synchronized (session) {
            if (session.isClosing()) {
                logger.warn("Cannot bind connection {}: session {} is closing", connection.id(), sessionId);
                return false;
            }
            if (session.getConnection() != null) {
                logger.warn("Session {} already has connection {}, rejecting {}", sessionId,
                        session.getConnection().id(), connection.id());
                return false;
            }
            session.setConnection(connection);
            session.setPhase(SessionPhase.CONNECTING);
            session.markActivity(System.currentTimeMillis());
        }
        logger.info("Connection {} bound to session {}", connection.id(), sessionId);
        return true;
    }

    public void updatePhase(String sessionId, SessionPhase phase) {
        find(sessionId).ifPresent(session -> {
            synchronized (session) {
                if (!session.isClosing()) {
                    session.setPhase(phase);
                }
            }
        });
    }

    /**
     * Install and start the session's coordinator unless one is already live.
     *
     * @return false if the session is closing or a coordinator is still running
     * @throws java.util.concurrent.RejectedExecutionException if the executor is saturated
     */
    public boolean startCoordinator(String sessionId, CoordinatorTask task, Executor executor) {
        ScanSession session = require(sessionId);
        synchronized (session) {
            if (session.isClosing()) {
                return false;
            }
            CoordinatorTask existing = session.getCoordinatorTask();
            if (existing != null && !existing.isFinished()) {
                logger.warn("Session {} already has a running coordinator, not starting another", sessionId);
                return false;
            }
            session.setCoordinatorTask(task);
            try {
                task.start(executor);
            } catch (RuntimeException e) {
                session.setCoordinatorTask(null);
                throw e;
            }
        }
        logger.info("Coordinator started for session {}", sessionId);
        return true;
    }

    /**
     * Tear a session down. Safe to call any number of times from any thread.
     * Order: stop the coordinator and wait for it, close the video, delete the
     * file, drop the connection, erase the entry. Each step runs even if an
     * earlier one failed.
     *
     * @return true if this call performed the teardown
     */
    public boolean remove(String sessionId) {
        return removeIf(sessionId, session -> true);
    }

    /**
     * Remove every session that never had a connection bound and was created
     * before {@code cutoff}. A session that binds concurrently is left alone.
     *
     * @return ids of the sessions removed
     */
    public List<String> removeUnclaimed(Instant cutoff) {
        List<String> removed = new ArrayList<>();
        for (ScanSession session : activeSessions()) {
            if (removeIf(session.getId(), s -> isUnclaimed(s, cutoff))) {
                removed.add(session.getId());
            }
        }
        if (!removed.isEmpty()) {
            logger.info("Removed {} unclaimed sessions created before {}", removed.size(), cutoff);
        }
        return removed;
    }

    private static boolean isUnclaimed(ScanSession session, Instant cutoff) {
        return session.getConnection() == null
                && session.getPhase() == SessionPhase.PENDING
                && session.getCreatedAt().isBefore(cutoff);
    }

    /**
     * Tear a session down if {@code condition} holds. The condition is
     * evaluated under the session monitor, so it sees no concurrent bind or attach.
     */
    boolean removeIf(String sessionId, Predicate<ScanSession> condition) {
        ScanSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            logger.debug("Remove of unknown session {} ignored", sessionId);
            return false;
        }

        synchronized (session) {
            if (session.isClosing() || !condition.test(session)) {
                return false;
            }
            session.markClosing();
            session.setPhase(SessionPhase.CLOSED);
        }

        CoordinatorTask task = session.getCoordinatorTask();
        if (task != null) {
            try {
                task.cancel();
                if (!task.awaitTermination(properties.getScan().teardownAwait())) {
                    logger.warn("Coordinator for session {} did not stop within {}ms",
                            sessionId, properties.getScan().getTeardownAwaitMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for coordinator of session {}", sessionId);
            } catch (RuntimeException e) {
                logger.error("Error cancelling coordinator for session {}: {}", sessionId, e.getMessage(), e);
            } finally {
                session.setCoordinatorTask(null);
            }
        }

        try {
            resourceManager.closeVideoSource(session);
        } catch (RuntimeException e) {
            logger.error("Error releasing video for session {}: {}", sessionId, e.getMessage(), e);
        }

        try {
            resourceManager.deleteVideoFile(session.getVideoPath());
        } catch (RuntimeException e) {
            logger.error("Error deleting video for session {}: {}", sessionId, e.getMessage(), e);
        }

        session.setConnection(null);
        sessions.remove(sessionId, session);

        logger.info("Session {} removed ({} active)", sessionId, sessions.size());
        return true;
    }
}

package com.framescan.framescan.service.session;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

import com.framescan.framescan.model.VideoProperties;
import com.framescan.framescan.service.video.VideoSource;

/**
 * All state owned by one session. Resource fields are written by the
 * {@link SessionRegistry} under this object's monitor; the video source is
 * additionally only used, and released, while holding {@link #cursorLock()}.
 */
public class ScanSession {

    private final String id;
    private final Instant createdAt = Instant.now();
    private final ReentrantLock cursorLock = new ReentrantLock();

    private volatile Path videoPath;
    private volatile VideoProperties properties;
    private volatile VideoSource videoSource;
    private volatile CoordinatorTask coordinatorTask;
    private volatile SessionConnection connection;
    private volatile SessionPhase phase = SessionPhase.PENDING;

    /** Set once teardown begins; nothing may decode after this. */
    private volatile boolean closing = false;

    /** Last inbound message or keepalive, epoch millis. */
    private volatile long lastActivityAt = System.currentTimeMillis();

    ScanSession(String id) {
        this.id = id;
    }

    public String getId() { return id; }
    public Instant getCreatedAt() { return createdAt; }
    public Path getVideoPath() { return videoPath; }
    public VideoProperties getProperties() { return properties; }
    public VideoSource getVideoSource() { return videoSource; }
    public CoordinatorTask getCoordinatorTask() { return coordinatorTask; }
    public SessionConnection getConnection() { return connection; }
    public SessionPhase getPhase() { return phase; }
    public boolean isClosing() { return closing; }
    public long getLastActivityAt() { return lastActivityAt; }

    public ReentrantLock cursorLock() {
        return cursorLock;
    }

    public boolean hasOpenConnection() {
        SessionConnection c = connection;
        return c != null && c.isOpen();
    }

    public boolean isBoundTo(SessionConnection candidate) {
        return candidate != null && connection == candidate;
    }

    public void markActivity(long epochMillis) {
        this.lastActivityAt = epochMillis;
    }

    void setPhase(SessionPhase phase) { this.phase = phase; }
    void setVideoPath(Path videoPath) { this.videoPath = videoPath; }
    void setProperties(VideoProperties properties) { this.properties = properties; }
    void setVideoSource(VideoSource videoSource) { this.videoSource = videoSource; }
    void setCoordinatorTask(CoordinatorTask coordinatorTask) { this.coordinatorTask = coordinatorTask; }
    void setConnection(SessionConnection connection) { this.connection = connection; }
    void markClosing() { this.closing = true; }
}

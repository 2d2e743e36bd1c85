package com.framescan.framescan.service.session;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.framescan.framescan.exception.SessionError;
import com.framescan.framescan.exception.SessionException;
import com.framescan.framescan.model.VideoProperties;
import com.framescan.framescan.testsupport.RecordingConnection;
import com.framescan.framescan.testsupport.StubVideoSource;

class SessionRegistryTest {

    @TempDir
    Path dir;

    private SessionFixture fx;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        fx = new SessionFixture(dir, 30.0, 300);
        registry = fx.registry;
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void createIssuesDistinctIds() {
        String a = registry.create();
        String b = registry.create();

        assertNotEquals(a, b);
        assertEquals(2, registry.size());
        assertEquals(SessionPhase.PENDING, registry.require(a).getPhase());
    }

    @Test
    void requireUnknownSessionFails() {
        SessionException e = assertThrows(SessionException.class, () -> registry.require("missing"));
        assertEquals(SessionError.SESSION_NOT_FOUND, e.getError());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void attachPublishesPropertiesAndLeavesCursorAtFirstFrame() throws Exception {
        String id = fx.provision();

        VideoProperties props = registry.attach(id, registry.require(id).getVideoPath());

        assertEquals(30.0, props.getFrameRate());
        assertEquals(300, props.getTotalFrames());
        assertEquals(10.0, props.getDuration(), 1e-9);
        StubVideoSource source = fx.videos.last();
        assertEquals(0, source.cursor());
        List<String> calls = source.calls();
        assertTrue(calls.get(0).startsWith("seek:0:"));
        assertTrue(calls.get(1).startsWith("read:0:"));
        assertTrue(calls.get(2).startsWith("seek:0:"));
        assertSame(source, registry.require(id).getVideoSource());
    }

    @Test
    void attachTwiceKeepsTheExistingHandle() throws Exception {
        ScanSession session = fx.provisionAttached();

        registry.attach(session.getId(), session.getVideoPath());

        assertEquals(1, fx.videos.opened().size());
        assertEquals(0, fx.videos.last().closeCount());
    }

    @Test
    void attachUnreadableVideoLeavesNothingAllocated() throws Exception {
        String id = fx.provision();
        fx.videos.failToOpen();

        SessionException e = assertThrows(SessionException.class,
                () -> registry.attach(id, registry.require(id).getVideoPath()));

        assertEquals(SessionError.VIDEO_UNREADABLE, e.getError());
        assertNull(registry.require(id).getVideoSource());
    }

    @Test
    void attachEmptyVideoClosesTheHandle() throws Exception {
        String id = fx.provision();
        fx.videos.supply(() -> new StubVideoSource(30.0, 0).empty());

        SessionException e = assertThrows(SessionException.class,
                () -> registry.attach(id, registry.require(id).getVideoPath()));

        assertEquals(SessionError.EMPTY_VIDEO, e.getError());
        assertEquals(1, fx.videos.last().closeCount());
        assertNull(registry.require(id).getVideoSource());
    }

    @Test
    void secondConnectionIsRejected() throws Exception {
        String id = fx.provision();
        RecordingConnection first = new RecordingConnection();
        RecordingConnection second = new RecordingConnection();

        assertTrue(registry.bindConnection(id, first));
        assertFalse(registry.bindConnection(id, second));

        assertTrue(registry.require(id).isBoundTo(first));
        assertEquals(SessionPhase.CONNECTING, registry.require(id).getPhase());
    }

    @Test
    void removeReleasesEverythingAndIsIdempotent() throws Exception {
        ScanSession session = fx.provisionAttached();
        String id = session.getId();
        Path file = session.getVideoPath();
        registry.bindConnection(id, new RecordingConnection());
        StubVideoSource source = fx.videos.last();

        assertTrue(registry.remove(id));
        assertFalse(registry.remove(id));
        assertFalse(registry.remove("never-existed"));

        assertTrue(registry.find(id).isEmpty());
        assertFalse(Files.exists(file));
        assertEquals(1, source.closeCount());
        assertNull(session.getConnection());
        assertTrue(session.isClosing());
        assertEquals(SessionPhase.CLOSED, session.getPhase());
    }

    @Test
    void unclaimedSessionsPastTheCutoffAreRemoved() throws Exception {
        String abandoned = fx.provision();
        Path abandonedFile = registry.require(abandoned).getVideoPath();
        String connected = fx.provision();
        registry.bindConnection(connected, new RecordingConnection());
        Instant cutoff = Instant.now().plusSeconds(1);

        List<String> removed = registry.removeUnclaimed(cutoff);

        assertEquals(List.of(abandoned), removed);
        assertTrue(registry.find(abandoned).isEmpty());
        assertFalse(Files.exists(abandonedFile));
        assertTrue(registry.find(connected).isPresent());
    }

    @Test
    void recentUnclaimedSessionsAreKept() throws Exception {
        String fresh = fx.provision();

        List<String> removed = registry.removeUnclaimed(Instant.now().minusSeconds(600));

        assertTrue(removed.isEmpty());
        assertTrue(registry.find(fresh).isPresent());
    }

    @Test
    void conditionalRemoveIsCheckedUnderTheSessionMonitor() throws Exception {
        String id = fx.provision();
        registry.bindConnection(id, new RecordingConnection());

        assertFalse(registry.removeIf(id, s -> s.getConnection() == null));

        assertTrue(registry.find(id).isPresent());
        assertFalse(registry.require(id).isClosing());
    }

    @Test
    void removeToleratesFileAlreadyDeleted() throws Exception {
        ScanSession session = fx.provisionAttached();
        Files.delete(session.getVideoPath());

        assertTrue(registry.remove(session.getId()));

        assertTrue(registry.find(session.getId()).isEmpty());
        assertEquals(1, fx.videos.last().closeCount());
    }

    @Test
    void removeCancelsAndAwaitsTheCoordinatorBeforeClosing() throws Exception {
        ScanSession session = fx.provisionAttached();
        StubVideoSource source = fx.videos.last();
        CountDownLatch started = new CountDownLatch(1);
        AtomicInteger closedWhileRunning = new AtomicInteger();
        CoordinatorTask task = new CoordinatorTask(session.getId(), t -> {
            started.countDown();
            try {
                while (t.pause(Duration.ofMillis(1))) {
                    // spin until cancelled
                }
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (source.isClosed()) {
                closedWhileRunning.incrementAndGet();
            }
        });

        assertTrue(registry.startCoordinator(session.getId(), task, fx.coordinatorExecutor));
        assertTrue(started.await(2, TimeUnit.SECONDS));

        registry.remove(session.getId());

        assertTrue(task.isFinished());
        assertEquals(0, closedWhileRunning.get());
        assertTrue(source.isClosed());
    }

    @Test
    void onlyOneLiveCoordinatorPerSession() throws Exception {
        ScanSession session = fx.provisionAttached();
        CountDownLatch release = new CountDownLatch(1);
        CoordinatorTask first = new CoordinatorTask(session.getId(), t -> {
            try {
                release.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        CoordinatorTask second = new CoordinatorTask(session.getId(), t -> { });

        assertTrue(registry.startCoordinator(session.getId(), first, fx.coordinatorExecutor));
        assertFalse(registry.startCoordinator(session.getId(), second, fx.coordinatorExecutor));
        assertSame(first, session.getCoordinatorTask());

        release.countDown();
        assertTrue(first.awaitTermination(Duration.ofSeconds(2)));
    }

    @Test
    void rejectedCoordinatorLeavesNoTaskBehind() throws Exception {
        ScanSession session = fx.provisionAttached();
        CoordinatorTask task = new CoordinatorTask(session.getId(), t -> { });

        assertThrows(RejectedExecutionException.class,
                () -> registry.startCoordinator(session.getId(), task, r -> {
                    throw new RejectedExecutionException("full");
                }));

        assertNull(session.getCoordinatorTask());
    }

    @Test
    void concurrentRemovesTearDownExactlyOnce() throws Exception {
        ScanSession session = fx.provisionAttached();
        StubVideoSource source = fx.videos.last();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger performed = new AtomicInteger();
        try {
            for (int i = 0; i < 8; i++) {
                pool.execute(() -> {
                    try {
                        go.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    if (registry.remove(session.getId())) {
                        performed.incrementAndGet();
                    }
                });
            }
            go.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, performed.get());
        assertEquals(1, source.closeCount());
        assertEquals(0, registry.size());
    }
}

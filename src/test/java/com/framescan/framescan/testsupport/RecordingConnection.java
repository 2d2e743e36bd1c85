package com.framescan.framescan.testsupport;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import com.framescan.framescan.model.dto.SessionEvent;
import com.framescan.framescan.service.session.SessionConnection;

/**
 * In-memory connection that records everything sent to it.
 */
public class RecordingConnection implements SessionConnection {

    private static final AtomicInteger SEQ = new AtomicInteger();

    private final String id = "conn-" + SEQ.incrementAndGet();
    private final List<SessionEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicInteger closeCount = new AtomicInteger();
    private volatile boolean open = true;
    private volatile boolean failSends = false;

    public RecordingConnection failSends() {
        this.failSends = true;
        return this;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(SessionEvent event) throws IOException {
        if (failSends) {
            throw new IOException("broken pipe");
        }
        if (!open) {
            throw new IOException("connection closed");
        }
        events.add(event);
    }

    @Override
    public void close() {
        open = false;
        closeCount.incrementAndGet();
    }

    /** Simulates the client going away without a close from our side. */
    public void drop() {
        open = false;
    }

    public List<SessionEvent> events() {
        return new ArrayList<>(events);
    }

    @SuppressWarnings("unchecked")
    public <T extends SessionEvent> List<T> eventsOfType(Class<T> type) {
        return (List<T>) events.stream().filter(type::isInstance).collect(Collectors.toList());
    }

    public List<String> types() {
        return events.stream().map(SessionEvent::getType).collect(Collectors.toList());
    }

    public int closeCount() {
        return closeCount.get();
    }

    /**
     * Poll until at least {@code count} events of the given type have arrived.
     */
    public <T extends SessionEvent> List<T> awaitEvents(Class<T> type, int count, long timeoutMillis)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        List<T> found = eventsOfType(type);
        while (found.size() < count && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
            found = eventsOfType(type);
        }
        return found;
    }
}

package com.framescan.framescan.service.session;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Background task with cooperative cancellation and a termination
 * acknowledgement that can be awaited.
 * <p>
 * Unlike {@link java.util.concurrent.Future#cancel}, {@link #awaitTermination}
 * only returns once the body has actually returned, or once cancellation
 * has guaranteed it will never start.
 */
public final class CoordinatorTask implements Runnable {

    private final String sessionId;
    private final Consumer<CoordinatorTask> body;

    // Claimed either by run() or by a cancel() that arrives before run()
    private final AtomicBoolean claimed = new AtomicBoolean(false);
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile Thread runner;

    public CoordinatorTask(String sessionId, Consumer<CoordinatorTask> body) {
        this.sessionId = sessionId;
        this.body = body;
    }

    public String getSessionId() {
        return sessionId;
    }

    void start(Executor executor) {
        executor.execute(this);
    }

    @Override
    public void run() {
        if (!claimed.compareAndSet(false, true)) {
            return;
        }
        runner = Thread.currentThread();
        try {
            body.accept(this);
        } finally {
            runner = null;
            finished.countDown();
        }
    }

    public void cancel() {
        cancelSignal.countDown();
        if (claimed.compareAndSet(false, true)) {
            finished.countDown();
        }
    }

    public boolean isCancelled() {
        return cancelSignal.getCount() == 0;
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    /**
     * Sleep between ticks, waking early on cancellation.
     *
     * @return true if the task should keep running
     */
    public boolean pause(Duration delay) throws InterruptedException {
        return !cancelSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Wait until the body has returned. Called from the task's own thread it
     * returns immediately, since the body is by definition not inside a decode
     * call at that point.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (Thread.currentThread() == runner) {
            return true;
        }
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}

package io.storvix.app;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Couples a JVM shutdown hook to the scheduler's own drain. The JVM halts as soon as every hook
 * has returned, so the hook signals the main thread and then blocks until {@link #markStopped()}
 * is called or the grace period runs out.
 */
final class SchedulerShutdown {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerShutdown.class);

    private final CountDownLatch requested = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final Duration grace;

    SchedulerShutdown(Duration grace) {
        if (grace == null || grace.isNegative()) {
            throw new IllegalArgumentException("grace must not be negative");
        }
        this.grace = grace;
    }

    Thread hook() {
        return new Thread(this::onSignal, "storvix-shutdown");
    }

    void onSignal() {
        requested.countDown();
        try {
            if (!stopped.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Scheduler did not stop within {}s, exiting anyway", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void awaitRequest() throws InterruptedException {
        requested.await();
    }

    void markStopped() {
        stopped.countDown();
    }
}

package io.storvix.core.artifact;

import io.storvix.core.schedule.ReportFormat;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds how long a delegate producer may run. A producer that overruns is interrupted and the
 * call fails with {@link ArtifactProductionException}.
 */
public final class TimeBoundArtifactProducer implements ArtifactProducer, AutoCloseable {
    private final ArtifactProducer delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeBoundArtifactProducer(ArtifactProducer delegate, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.delegate = delegate;
        this.timeout = timeout;
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "storvix-artifact");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public Artifact produce(String target, List<String> sections, ReportFormat format) throws ArtifactProductionException {
        Future<Artifact> future = executor.submit(() -> delegate.produce(target, sections, format));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ArtifactProductionException("report for " + target + " not produced within " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ArtifactProductionException("interrupted while producing report for " + target, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ArtifactProductionException production) {
                throw production;
            }
            throw new ArtifactProductionException("report for " + target + " failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}

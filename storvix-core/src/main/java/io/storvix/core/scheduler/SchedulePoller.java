package io.storvix.core.scheduler;

import io.storvix.core.artifact.ArtifactProductionException;
import io.storvix.core.delivery.DeliveryResult;
import io.storvix.core.schedule.AdvanceOutcome;
import io.storvix.core.schedule.Frequency;
import io.storvix.core.schedule.FrequencyResolver;
import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.ScheduleStateStore;
import io.storvix.core.schedule.ScheduledJob;
import io.storvix.core.subscription.SubscriptionSweeper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Clock-driven driver for one or more job classes.
 *
 * <p>A tick reads the clock once and uses that instant for selection and for rescheduling. Every
 * due job is executed, then all pending deliveries are awaited together, then each job is advanced
 * or retired. A failed production or delivery still consumes the occurrence; only a failed write of
 * the schedule itself leaves the job due for the next tick.
 *
 * <p>Only one instance may poll a given store. Two pollers on the same store select and deliver
 * the same due jobs twice.
 */
public final class SchedulePoller implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulePoller.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final String name;
    private final Set<JobKind> kinds;
    private final Map<JobKind, JobHandler> handlers;
    private final ScheduleStateStore store;
    private final DueJobSelector selector;
    private final FrequencyResolver resolver;
    private final SubscriptionSweeper sweeper;
    private final Clock clock;
    private final Duration deliveryTimeout;
    private final AtomicReference<TickReport> lastReport = new AtomicReference<>();
    private final Object lifecycle = new Object();
    private volatile PollerState state = PollerState.IDLE;
    private ScheduledExecutorService executor;

    public SchedulePoller(
        String name,
        List<JobHandler> handlers,
        ScheduleStateStore store,
        FrequencyResolver resolver,
        SubscriptionSweeper sweeper,
        Clock clock,
        Duration deliveryTimeout
    ) {
        if (handlers == null || handlers.isEmpty()) {
            throw new IllegalArgumentException("at least one job handler is required");
        }
        if (deliveryTimeout == null || deliveryTimeout.isZero() || deliveryTimeout.isNegative()) {
            throw new IllegalArgumentException("deliveryTimeout must be positive");
        }
        this.name = name;
        this.handlers = new EnumMap<>(JobKind.class);
        for (JobHandler handler : handlers) {
            this.handlers.put(handler.kind(), handler);
        }
        this.kinds = Set.copyOf(this.handlers.keySet());
        this.store = store;
        this.selector = new DueJobSelector(store);
        this.resolver = resolver;
        this.sweeper = sweeper;
        this.clock = clock;
        this.deliveryTimeout = deliveryTimeout;
    }

    public String name() {
        return name;
    }

    public Set<JobKind> kinds() {
        return kinds;
    }

    public PollerState state() {
        return state;
    }

    public Optional<TickReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public synchronized TickReport tick() {
        Instant now = clock.instant();
        try {
            state = PollerState.SCANNING;
            int expired = 0;
            String sweepFailure = null;
            if (sweeper != null) {
                try {
                    expired = sweeper.sweep(now);
                } catch (Exception e) {
                    LOG.error("[{}] Subscription sweep failed at {}", name, now, e);
                    sweepFailure = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                }
            }

            DueSelection selection = selector.select(kinds, now);

            state = PollerState.EXECUTING;
            List<Execution> executions = new ArrayList<>(selection.jobs().size());
            for (ScheduledJob job : selection.jobs()) {
                executions.add(start(job, now));
            }
            List<DeliveryResult> results = new ArrayList<>(executions.size());
            for (Execution execution : executions) {
                results.add(await(execution));
            }

            state = PollerState.ADVANCING;
            List<JobOutcome> outcomes = new ArrayList<>(executions.size());
            for (int i = 0; i < executions.size(); i++) {
                ScheduledJob job = executions.get(i).job();
                DeliveryResult result = results.get(i);
                AdvanceOutcome advance = advance(job, now);
                outcomes.add(new JobOutcome(job.id(), job.kind(), result.delivered(), result.delivered() ? null : result.detail(), advance));
            }

            TickReport report = new TickReport(name, now, outcomes, selection.unreadableKinds(), expired, sweepFailure);
            lastReport.set(report);
            if (report.due() > 0) {
                LOG.info(
                    "[{}] tick at {}: {} due, {} delivered, {} failed, {} retry pending",
                    name, now, report.due(), report.delivered(), report.failed(), report.retryPending()
                );
            } else {
                LOG.debug("[{}] tick at {}: nothing due", name, now);
            }
            return report;
        } finally {
            state = PollerState.IDLE;
        }
    }

    public void start(Duration initialDelay, Duration period) {
        synchronized (lifecycle) {
            if (executor != null) {
                throw new IllegalStateException("poller " + name + " already started");
            }
            executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "storvix-" + name);
                thread.setDaemon(true);
                return thread;
            });
            executor.scheduleAtFixedRate(this::safeTick, initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        }
        LOG.info("[{}] polling {} every {}s", name, kinds, period.toSeconds());
    }

    /**
     * Stops scheduling new ticks and waits a bounded time for a tick in flight.
     */
    @Override
    public void close() {
        ScheduledExecutorService running;
        synchronized (lifecycle) {
            running = executor;
            executor = null;
        }
        if (running == null) {
            return;
        }
        running.shutdown();
        try {
            if (!running.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("[{}] tick still running after {}s, interrupting", name, SHUTDOWN_GRACE.toSeconds());
                running.shutdownNow();
            }
        } catch (InterruptedException e) {
            running.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the periodic task
            LOG.error("[{}] tick failed", name, e);
        }
    }

    private Execution start(ScheduledJob job, Instant now) {
        JobHandler handler = handlers.get(job.kind());
        long startedAt = System.nanoTime();
        try {
            CompletableFuture<DeliveryResult> pending = handler.execute(job, now);
            return new Execution(job, pending, startedAt);
        } catch (ArtifactProductionException e) {
            LOG.error("Report production failed for {} schedule {}: {}", job.kind().wireName(), job.id(), e.getMessage());
            return new Execution(job, CompletableFuture.completedFuture(DeliveryResult.failed("production failed: " + e.getMessage())), startedAt);
        } catch (Exception e) {
            LOG.error("Executing {} schedule {} failed", job.kind().wireName(), job.id(), e);
            return new Execution(job, CompletableFuture.completedFuture(DeliveryResult.failed(String.valueOf(e.getMessage()))), startedAt);
        }
    }

    private DeliveryResult await(Execution execution) {
        ScheduledJob job = execution.job();
        long remaining = deliveryTimeout.toNanos() - (System.nanoTime() - execution.startedAt());
        try {
            DeliveryResult result = execution.pending().get(Math.max(remaining, 0L), TimeUnit.NANOSECONDS);
            if (result == null) {
                return DeliveryResult.failed("no delivery result");
            }
            if (!result.delivered()) {
                LOG.warn("Delivery failed for {} schedule {}: {}", job.kind().wireName(), job.id(), result.detail());
            }
            return result;
        } catch (TimeoutException e) {
            execution.pending().cancel(true);
            LOG.warn("Delivery for {} schedule {} timed out after {}s", job.kind().wireName(), job.id(), deliveryTimeout.toSeconds());
            return DeliveryResult.failed("delivery timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.failed("interrupted");
        } catch (ExecutionException | RuntimeException e) {
            LOG.warn("Delivery for {} schedule {} failed", job.kind().wireName(), job.id(), e);
            return DeliveryResult.failed(String.valueOf(e.getMessage()));
        }
    }

    private AdvanceOutcome advance(ScheduledJob job, Instant now) {
        Optional<Instant> next = job.frequency() == Frequency.ONCE
            ? Optional.empty()
            : resolver.resolve(now, job.frequency(), job.customInterval());
        try {
            AdvanceOutcome outcome = store.advanceOrRetire(job.id(), now, next);
            LOG.debug("{} schedule {} {} next={}", job.kind().wireName(), job.id(), outcome, next.orElse(null));
            return outcome;
        } catch (Exception e) {
            LOG.error("Could not advance {} schedule {}, it stays due for the next tick", job.kind().wireName(), job.id(), e);
            return null;
        }
    }

    private record Execution(ScheduledJob job, CompletableFuture<DeliveryResult> pending, long startedAt) {
    }
}

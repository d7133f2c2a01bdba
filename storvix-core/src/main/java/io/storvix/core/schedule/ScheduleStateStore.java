package io.storvix.core.schedule;

import io.storvix.core.schedule.store.ScheduleRepository;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the temporal state transitions of scheduled jobs. All writes are serialized on this
 * instance, so a job is never written by two callers at once.
 */
public final class ScheduleStateStore {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleStateStore.class);

    private final ScheduleRepository repository;

    public ScheduleStateStore(ScheduleRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
    }

    public synchronized ScheduledJob create(ScheduledJob job) throws IOException {
        ScheduledJobValidator.validate(job);
        ScheduledJob pending = new ScheduledJob(
            job.id(),
            job.owner(),
            job.payload(),
            job.frequency(),
            job.customInterval(),
            job.firstRunAt(),
            job.firstRunAt(),
            null,
            job.createdAt()
        );
        repository.insert(pending);
        return pending;
    }

    public synchronized List<ScheduledJob> findDue(JobKind kind, Instant now) throws IOException {
        return repository.findDue(kind, now);
    }

    public synchronized Optional<ScheduledJob> get(String id) throws IOException {
        return repository.findById(id);
    }

    public synchronized List<ScheduledJob> list(JobKind kind) throws IOException {
        return repository.findByKind(kind);
    }

    /**
     * Records an execution at {@code now}. With a next time the job is rescheduled; without one a
     * report job is kept as completed history and a mail job is removed.
     */
    public synchronized AdvanceOutcome advanceOrRetire(String jobId, Instant now, Optional<Instant> next) throws IOException {
        Objects.requireNonNull(now, "now must not be null");
        Optional<ScheduledJob> current = repository.findById(jobId);
        if (current.isEmpty()) {
            // cancelled while it was executing
            LOG.info("Schedule {} disappeared before it could be advanced", jobId);
            return AdvanceOutcome.MISSING;
        }
        ScheduledJob job = current.get();
        if (next.isPresent()) {
            if (!next.get().isAfter(now)) {
                throw new IllegalStateException("next run " + next.get() + " of schedule " + jobId + " is not after " + now);
            }
            return repository.update(job.advancedTo(now, next.get())) ? AdvanceOutcome.ADVANCED : AdvanceOutcome.MISSING;
        }
        if (job.kind().retainsCompletedJobs()) {
            return repository.update(job.completedAt(now)) ? AdvanceOutcome.COMPLETED : AdvanceOutcome.MISSING;
        }
        return repository.delete(jobId) ? AdvanceOutcome.DELETED : AdvanceOutcome.MISSING;
    }

    public synchronized Optional<ScheduledJob> cancel(String jobId) throws IOException {
        Optional<ScheduledJob> current = repository.findById(jobId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        return repository.delete(jobId) ? current : Optional.empty();
    }
}

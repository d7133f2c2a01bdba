package io.storvix.core.schedule;

import io.storvix.core.delivery.DeliveryAgent;
import io.storvix.core.delivery.DeliveryResult;
import io.storvix.core.delivery.MailMessage;
import io.storvix.core.directory.UserDirectory;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User-facing schedule management: create, list and cancel report and mail jobs.
 *
 * <p>{@code customInterval} is read in hours up to {@value CustomInterval#HOURS_THRESHOLD} and in
 * days above it, see {@link CustomInterval}. It is dropped for every frequency other than custom.
 */
public final class ScheduleService {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleService.class);
    private static final DateTimeFormatter REPORT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT)
        .withZone(ZoneOffset.UTC);

    private final ScheduleStateStore store;
    private final FrequencyResolver resolver;
    private final UserDirectory directory;
    private final DeliveryAgent delivery;
    private final Clock clock;
    private final Set<CompletableFuture<?>> pendingNotices = ConcurrentHashMap.newKeySet();

    public ScheduleService(
        ScheduleStateStore store,
        FrequencyResolver resolver,
        UserDirectory directory,
        DeliveryAgent delivery,
        Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.directory = directory;
        this.delivery = delivery;
        this.clock = clock;
    }

    /**
     * Validates and persists a new job. Nothing is stored when the request is rejected.
     *
     * @throws InvalidScheduleException when frequency, interval or payload cannot be scheduled
     */
    public ScheduledJob schedule(ScheduleRequest request) throws IOException {
        if (request == null) {
            throw new InvalidScheduleException("Invalid scheduling parameters: request is required");
        }
        Instant now = clock.instant();
        Frequency frequency = Frequency.parse(request.frequency())
            .orElseThrow(() -> new InvalidScheduleException("Invalid scheduling parameters: unknown frequency '" + request.frequency() + "'"));
        if (frequency != Frequency.ONCE && resolver.resolve(now, frequency, request.customInterval()).isEmpty()) {
            throw new InvalidScheduleException("Invalid scheduling parameters: customInterval must be a positive number up to "
                + CustomInterval.MAX_VALUE + " when frequency is custom");
        }
        if (request.owner() == null || request.owner().userId().isBlank()) {
            throw new InvalidScheduleException("Invalid scheduling parameters: owner is required");
        }
        try {
            ScheduledJobValidator.validatePayload(request.payload());
        } catch (InvalidScheduleException e) {
            throw new InvalidScheduleException("Invalid scheduling parameters: " + e.getMessage());
        }

        ScheduledJob job = store.create(new ScheduledJob(
            UUID.randomUUID().toString(),
            request.owner(),
            request.payload(),
            frequency,
            frequency == Frequency.CUSTOM ? request.customInterval() : null,
            request.firstRunAt() == null ? now : request.firstRunAt(),
            null,
            null,
            now
        ));
        LOG.info("Created {} schedule {} ({}) for user {}", job.kind().wireName(), job.id(), frequency.wireName(), job.owner().userId());
        if (job.kind() == JobKind.REPORT) {
            confirm(job, now);
        }
        return job;
    }

    /**
     * Jobs of one class, optionally narrowed to an owner and a company. Blank filters match everything.
     */
    public List<ScheduledJob> list(JobKind kind, String ownerId, String company) throws IOException {
        return store.list(kind).stream()
            .filter(job -> ownerId == null || ownerId.isBlank() || job.owner().userId().equals(ownerId))
            .filter(job -> company == null || company.isBlank() || job.owner().company().equalsIgnoreCase(company))
            .toList();
    }

    public Optional<ScheduledJob> get(String id) throws IOException {
        return store.get(id);
    }

    /**
     * Deletes a job of either class. The owner is notified on a best-effort basis; a failed
     * notice does not fail the cancellation.
     */
    public Optional<ScheduledJob> cancel(String id) throws IOException {
        Optional<ScheduledJob> cancelled = store.cancel(id);
        cancelled.ifPresent(job -> {
            LOG.info("Cancelled {} schedule {}", job.kind().wireName(), job.id());
            if (job.payload() instanceof ReportPayload report) {
                notifyOwner(job, "Scheduled Report Cancelled",
                    "Your scheduled report for host \"" + report.target() + "\" has been cancelled.");
            } else if (job.payload() instanceof MailPayload mail) {
                String subject = mail.subject().isBlank() ? "scheduled mail" : "\"" + mail.subject() + "\"";
                notifyOwner(job, "Scheduled Mail Cancelled", "Your " + subject + " schedule has been cancelled.");
            }
        });
        return cancelled;
    }

    /**
     * Blocks until the owner notices sent so far have completed. Short-lived callers such as the
     * CLI use it so that a notice is not lost when the process exits.
     *
     * @return {@code false} when notices were still in flight after {@code timeout}
     */
    public boolean awaitPendingNotices(Duration timeout) {
        CompletableFuture<?>[] pending = pendingNotices.toArray(new CompletableFuture<?>[0]);
        if (pending.length == 0) {
            return true;
        }
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (ExecutionException e) {
            LOG.debug("A notice finished with an error: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void confirm(ScheduledJob job, Instant now) {
        ReportPayload report = (ReportPayload) job.payload();
        String subject = report.isAggregate()
            ? "Aggregated Report - " + REPORT_DATE.format(now)
            : "Report for system " + report.target() + " - " + REPORT_DATE.format(now);
        String cadence = job.frequency() == Frequency.CUSTOM
            ? " (" + CustomInterval.describe(job.customInterval()) + ")"
            : "";
        String body = "You have scheduled the report with frequency \"" + job.frequency().wireName() + "\""
            + cadence + " for host \"" + report.target() + "\".";
        notifyOwner(job, "Schedule Confirmation: " + subject, body);
    }

    private void notifyOwner(ScheduledJob job, String subject, String body) {
        if (directory == null || delivery == null) {
            return;
        }
        Optional<String> email;
        try {
            email = directory.emailOf(job.owner().userId());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not look up email of user {} for '{}': {}", job.owner().userId(), subject, e.getMessage());
            return;
        }
        if (email.isEmpty()) {
            LOG.debug("User {} has no email, skipping '{}'", job.owner().userId(), subject);
            return;
        }
        CompletableFuture<DeliveryResult> notice = delivery.send(MailMessage.text(email.get(), subject, body));
        pendingNotices.add(notice);
        notice.whenComplete((result, error) -> {
            pendingNotices.remove(notice);
            if (error != null) {
                LOG.warn("Notice '{}' for schedule {} failed: {}", subject, job.id(), error.getMessage());
            } else if (!result.delivered()) {
                LOG.warn("Notice '{}' for schedule {} not delivered: {}", subject, job.id(), result.detail());
            }
        });
    }
}

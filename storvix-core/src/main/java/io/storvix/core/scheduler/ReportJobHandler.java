package io.storvix.core.scheduler;

import io.storvix.core.artifact.Artifact;
import io.storvix.core.artifact.ArtifactProducer;
import io.storvix.core.artifact.ArtifactProductionException;
import io.storvix.core.artifact.ReportArchive;
import io.storvix.core.delivery.DeliveryAgent;
import io.storvix.core.delivery.DeliveryResult;
import io.storvix.core.delivery.MailMessage;
import io.storvix.core.directory.UserDirectory;
import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.ReportPayload;
import io.storvix.core.schedule.ScheduledJob;
import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders the report, archives it and mails it to the job owner.
 */
public final class ReportJobHandler implements JobHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ReportJobHandler.class);
    private static final DateTimeFormatter GENERATED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'", Locale.ROOT)
        .withZone(ZoneOffset.UTC);

    private final ArtifactProducer producer;
    private final ReportArchive archive;
    private final UserDirectory directory;
    private final DeliveryAgent delivery;

    public ReportJobHandler(ArtifactProducer producer, ReportArchive archive, UserDirectory directory, DeliveryAgent delivery) {
        this.producer = producer;
        this.archive = archive;
        this.directory = directory;
        this.delivery = delivery;
    }

    @Override
    public JobKind kind() {
        return JobKind.REPORT;
    }

    @Override
    public CompletableFuture<DeliveryResult> execute(ScheduledJob job, Instant now) throws ArtifactProductionException, IOException {
        ReportPayload payload = (ReportPayload) job.payload();
        Artifact artifact = producer.produce(payload.target(), payload.sections(), payload.format());

        try {
            archive.store(job, artifact, now);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not archive report {} of schedule {}: {}", artifact.filename(), job.id(), e.getMessage());
        }

        Optional<String> email = directory.emailOf(job.owner().userId());
        if (email.isEmpty()) {
            LOG.warn("Report schedule {} has no delivery address for user {}", job.id(), job.owner().userId());
            return CompletableFuture.completedFuture(DeliveryResult.failed("owner has no email address"));
        }
        String subject = payload.isAggregate()
            ? "Scheduled Aggregated Report"
            : "Scheduled Report for system " + payload.target();
        String body = "Attached is your scheduled report generated at " + GENERATED_AT.format(now) + ".";
        return delivery.send(new MailMessage(List.of(email.get()), subject, body, null, artifact));
    }
}

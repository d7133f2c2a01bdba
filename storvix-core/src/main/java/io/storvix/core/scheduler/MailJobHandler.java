package io.storvix.core.scheduler;

import io.storvix.core.artifact.Artifact;
import io.storvix.core.artifact.ArtifactProducer;
import io.storvix.core.artifact.ArtifactProductionException;
import io.storvix.core.delivery.DeliveryAgent;
import io.storvix.core.delivery.DeliveryResult;
import io.storvix.core.delivery.MailBodies;
import io.storvix.core.delivery.MailMessage;
import io.storvix.core.fleet.SummaryComposer;
import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.MailPayload;
import io.storvix.core.schedule.ScheduledJob;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MailJobHandler implements JobHandler {
    public static final String DEFAULT_SUBJECT = "Systems Status Summary";
    private static final Logger LOG = LoggerFactory.getLogger(MailJobHandler.class);

    private final ArtifactProducer producer;
    private final SummaryComposer summaries;
    private final DeliveryAgent delivery;

    public MailJobHandler(ArtifactProducer producer, SummaryComposer summaries, DeliveryAgent delivery) {
        this.producer = producer;
        this.summaries = summaries;
        this.delivery = delivery;
    }

    @Override
    public JobKind kind() {
        return JobKind.MAIL;
    }

    @Override
    public CompletableFuture<DeliveryResult> execute(ScheduledJob job, Instant now) throws ArtifactProductionException {
        MailPayload payload = (MailPayload) job.payload();
        Artifact attachment = null;
        if (payload.attachReport()) {
            attachment = producer.produce(payload.target(), payload.sections(), payload.format());
        }

        String html = payload.body();
        if (payload.generateSummary()) {
            try {
                html = summaries.compose(payload.companies());
            } catch (Exception e) {
                // keep the stored body
                LOG.warn("Summary for mail schedule {} failed, sending stored body: {}", job.id(), e.getMessage());
            }
        }

        String subject = payload.subject().isBlank() ? DEFAULT_SUBJECT : payload.subject();
        String htmlBody = MailBodies.looksLikeHtml(html) ? html : null;
        return delivery.send(new MailMessage(payload.recipients(), subject, MailBodies.toPlainText(html), htmlBody, attachment));
    }
}

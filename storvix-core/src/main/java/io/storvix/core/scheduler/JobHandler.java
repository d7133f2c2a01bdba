package io.storvix.core.scheduler;

import io.storvix.core.artifact.ArtifactProductionException;
import io.storvix.core.delivery.DeliveryResult;
import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.ScheduledJob;
import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Executes one occurrence of a job class: produces what has to be produced synchronously and
 * returns the pending delivery.
 */
public interface JobHandler {
    JobKind kind();

    CompletableFuture<DeliveryResult> execute(ScheduledJob job, Instant now) throws ArtifactProductionException, IOException;
}

package io.storvix.core.artifact;

import io.storvix.core.schedule.ReportFormat;
import java.util.List;

/**
 * Renders report bytes for a target. A target of {@code "all"} asks for a fleet-wide aggregate,
 * anything else names a single host.
 */
public interface ArtifactProducer {
    Artifact produce(String target, List<String> sections, ReportFormat format) throws ArtifactProductionException;
}

package io.storvix.core.artifact;

import io.storvix.core.schedule.ScheduledJob;
import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Keeps every report produced by a scheduled run so it can be downloaded later.
 */
public interface ReportArchive {
    ArchivedReport store(ScheduledJob job, Artifact artifact, Instant createdAt) throws IOException;

    List<ArchivedReport> list() throws IOException;
}

package io.storvix.core.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.storvix.core.schedule.ReportFormat;
import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchivedReport(
    String id,
    String scheduleId,
    String ownerId,
    String company,
    String target,
    List<String> sections,
    ReportFormat format,
    String filename,
    String mimeType,
    long size,
    String file,
    Instant createdAt
) {
    public ArchivedReport {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }
}

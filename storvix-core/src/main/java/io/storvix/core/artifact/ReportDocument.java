package io.storvix.core.artifact;

import java.time.Instant;
import java.util.List;

/**
 * Format-neutral content of a report: a title block and one table.
 */
public record ReportDocument(
    String title,
    Instant generatedAt,
    List<String> sections,
    List<String> headers,
    List<List<String>> rows
) {
    public ReportDocument {
        title = title == null ? "" : title;
        sections = sections == null ? List.of() : List.copyOf(sections);
        headers = headers == null ? List.of() : List.copyOf(headers);
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }
}

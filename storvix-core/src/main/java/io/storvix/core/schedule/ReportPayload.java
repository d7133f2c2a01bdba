package io.storvix.core.schedule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * What a report job renders. {@code target} is either a single host id or
 * {@link #ALL_SYSTEMS}, which asks the producer for a fleet-wide aggregate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportPayload(
    String target,
    List<String> sections,
    ReportFormat format
) implements JobPayload {
    public static final String ALL_SYSTEMS = "all";

    public ReportPayload {
        target = target == null ? "" : target.trim();
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    @Override
    public JobKind kind() {
        return JobKind.REPORT;
    }

    @JsonIgnore
    public boolean isAggregate() {
        return ALL_SYSTEMS.equals(target);
    }
}

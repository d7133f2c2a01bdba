package io.storvix.core.schedule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * Durable temporal state of a report or mail job. {@code nextRunAt == null} means the job has no
 * further occurrence; {@code lastRunAt == null} means it has never run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduledJob(
    String id,
    JobOwner owner,
    JobPayload payload,
    Frequency frequency,
    Double customInterval,
    Instant firstRunAt,
    Instant nextRunAt,
    Instant lastRunAt,
    Instant createdAt
) {

    @JsonIgnore
    public JobKind kind() {
        return payload == null ? null : payload.kind();
    }

    public boolean isDueAt(Instant now) {
        return nextRunAt != null && !nextRunAt.isAfter(now);
    }

    public ScheduledJob advancedTo(Instant ranAt, Instant next) {
        return new ScheduledJob(id, owner, payload, frequency, customInterval, firstRunAt, next, ranAt, createdAt);
    }

    public ScheduledJob completedAt(Instant ranAt) {
        return new ScheduledJob(id, owner, payload, frequency, customInterval, firstRunAt, null, ranAt, createdAt);
    }
}

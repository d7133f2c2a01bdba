package io.storvix.core.schedule;

import java.time.Instant;

/**
 * A user's scheduling form as received. {@code frequency} is kept as raw text so that an unknown
 * value can be rejected with the same error as any other invalid combination.
 */
public record ScheduleRequest(
    JobOwner owner,
    JobPayload payload,
    String frequency,
    Double customInterval,
    Instant firstRunAt
) {
}

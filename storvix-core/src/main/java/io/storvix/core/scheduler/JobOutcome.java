package io.storvix.core.scheduler;

import io.storvix.core.schedule.AdvanceOutcome;
import io.storvix.core.schedule.JobKind;

/**
 * What happened to one due job during a tick. {@code advance} is {@code null} when its schedule
 * could not be written; such a job is still due on the next tick.
 */
public record JobOutcome(
    String jobId,
    JobKind kind,
    boolean delivered,
    String failure,
    AdvanceOutcome advance
) {
    public boolean retryPending() {
        return advance == null;
    }
}

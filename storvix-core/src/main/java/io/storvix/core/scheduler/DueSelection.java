package io.storvix.core.scheduler;

import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.ScheduledJob;
import java.util.List;

/**
 * Due jobs of one tick, plus the job classes whose store could not be read.
 */
public record DueSelection(
    List<ScheduledJob> jobs,
    List<JobKind> unreadableKinds
) {
    public DueSelection {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
        unreadableKinds = unreadableKinds == null ? List.of() : List.copyOf(unreadableKinds);
    }
}

package io.storvix.core.scheduler;

import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.ScheduleStateStore;
import io.storvix.core.schedule.ScheduledJob;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DueJobSelector {
    private static final Logger LOG = LoggerFactory.getLogger(DueJobSelector.class);

    private final ScheduleStateStore store;

    public DueJobSelector(ScheduleStateStore store) {
        this.store = store;
    }

    /**
     * Reads the due jobs of each class independently; a class whose store fails is reported and
     * skipped so the other classes still run.
     */
    public DueSelection select(Collection<JobKind> kinds, Instant now) {
        List<ScheduledJob> due = new ArrayList<>();
        List<JobKind> unreadable = new ArrayList<>();
        for (JobKind kind : kinds) {
            try {
                due.addAll(store.findDue(kind, now));
            } catch (IOException | RuntimeException e) {
                LOG.error("Could not select due {} schedules at {}", kind.wireName(), now, e);
                unreadable.add(kind);
            }
        }
        return new DueSelection(due, unreadable);
    }
}

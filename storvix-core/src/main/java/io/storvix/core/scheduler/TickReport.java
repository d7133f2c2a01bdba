package io.storvix.core.scheduler;

import io.storvix.core.schedule.AdvanceOutcome;
import io.storvix.core.schedule.JobKind;
import java.time.Instant;
import java.util.List;

public record TickReport(
    String poller,
    Instant now,
    List<JobOutcome> outcomes,
    List<JobKind> unreadableKinds,
    int expiredSubscriptions,
    String sweepFailure
) {
    public TickReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        unreadableKinds = unreadableKinds == null ? List.of() : List.copyOf(unreadableKinds);
    }

    public int due() {
        return outcomes.size();
    }

    public int delivered() {
        return (int) outcomes.stream().filter(JobOutcome::delivered).count();
    }

    public int failed() {
        return due() - delivered();
    }

    public int count(AdvanceOutcome advance) {
        return (int) outcomes.stream().filter(outcome -> outcome.advance() == advance).count();
    }

    public int retryPending() {
        return (int) outcomes.stream().filter(JobOutcome::retryPending).count();
    }
}

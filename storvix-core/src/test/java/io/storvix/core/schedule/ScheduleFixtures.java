package io.storvix.core.schedule;

import java.time.Instant;
import java.util.List;

public final class ScheduleFixtures {
    public static final JobOwner OWNER = new JobOwner("u-1", "alice", "Acme");

    private ScheduleFixtures() {
    }

    public static ScheduledJob reportJob(String id, Frequency frequency, Double interval, Instant firstRunAt) {
        return reportJob(id, "host-1", frequency, interval, firstRunAt);
    }

    public static ScheduledJob reportJob(String id, String target, Frequency frequency, Double interval, Instant firstRunAt) {
        return new ScheduledJob(
            id,
            OWNER,
            new ReportPayload(target, List.of("capacity"), ReportFormat.PDF),
            frequency,
            interval,
            firstRunAt,
            firstRunAt,
            null,
            firstRunAt
        );
    }

    public static ScheduledJob mailJob(String id, Frequency frequency, Double interval, Instant firstRunAt) {
        return new ScheduledJob(
            id,
            OWNER,
            MailPayload.plain(List.of("ops@acme.test"), "Weekly status", "<p>All good</p>"),
            frequency,
            interval,
            firstRunAt,
            firstRunAt,
            null,
            firstRunAt
        );
    }
}

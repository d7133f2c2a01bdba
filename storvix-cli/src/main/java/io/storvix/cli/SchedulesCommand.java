package io.storvix.cli;

import io.storvix.core.schedule.CustomInterval;
import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.MailPayload;
import io.storvix.core.schedule.ReportPayload;
import io.storvix.core.schedule.ScheduledJob;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "schedules", description = "List report and mail schedules")
public final class SchedulesCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--kind", description = "report or mail; both when omitted")
    String kind;

    @Option(names = "--user", description = "Only schedules owned by this user id")
    String userId;

    @Option(names = "--company", description = "Only schedules of this company")
    String company;

    public SchedulesCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        List<JobKind> kinds;
        if (kind == null || kind.isBlank()) {
            kinds = List.of(JobKind.REPORT, JobKind.MAIL);
        } else {
            JobKind parsed = JobKind.parse(kind).orElse(null);
            if (parsed == null) {
                System.err.println("Unknown schedule kind: " + kind);
                return 2;
            }
            kinds = List.of(parsed);
        }

        try {
            List<ScheduledJob> jobs = new ArrayList<>();
            for (JobKind each : kinds) {
                jobs.addAll(context.scheduleService().list(each, userId, company));
            }
            if (jobs.isEmpty()) {
                System.out.println("No schedules.");
                return 0;
            }
            for (ScheduledJob job : jobs) {
                System.out.println(describe(job));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Schedules command failed: " + e.getMessage());
            return 1;
        }
    }

    private static String describe(ScheduledJob job) {
        String subject;
        if (job.payload() instanceof ReportPayload report) {
            subject = "target=" + report.target() + (report.format() == null ? "" : " format=" + report.format().extension());
        } else if (job.payload() instanceof MailPayload mail) {
            subject = "to=" + String.join(",", mail.recipients());
        } else {
            subject = "";
        }
        String frequency = job.customInterval() == null
            ? job.frequency().wireName()
            : job.frequency().wireName() + "(" + CustomInterval.format(job.customInterval()) + ")";
        String next = job.nextRunAt() == null ? "completed" : "next=" + job.nextRunAt();
        return String.join(" ", job.id(), job.kind().wireName(), frequency, next, "owner=" + job.owner().userId(), subject).trim();
    }
}

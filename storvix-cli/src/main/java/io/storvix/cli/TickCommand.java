package io.storvix.cli;

import io.storvix.core.schedule.AdvanceOutcome;
import io.storvix.core.scheduler.TickReport;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "tick", description = "Run every poller once and print what happened")
public final class TickCommand implements Callable<Integer> {
    private final CliContext context;

    public TickCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            for (TickReport report : context.tickRunner().tickOnce()) {
                System.out.printf(
                    "%s: due=%d delivered=%d failed=%d advanced=%d completed=%d deleted=%d retryPending=%d%n",
                    report.poller(),
                    report.due(),
                    report.delivered(),
                    report.failed(),
                    report.count(AdvanceOutcome.ADVANCED),
                    report.count(AdvanceOutcome.COMPLETED),
                    report.count(AdvanceOutcome.DELETED),
                    report.retryPending()
                );
                if (report.expiredSubscriptions() > 0) {
                    System.out.println("  expired subscriptions: " + report.expiredSubscriptions());
                }
                if (report.sweepFailure() != null) {
                    System.out.println("  subscription sweep failed: " + report.sweepFailure());
                }
                if (!report.unreadableKinds().isEmpty()) {
                    System.out.println("  unreadable: " + report.unreadableKinds());
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Tick command failed: " + e.getMessage());
            return 1;
        }
    }
}

package io.storvix.cli;

import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "cancel", description = "Cancel a schedule and notify its owner")
public final class CancelCommand implements Callable<Integer> {
    private static final Duration NOTICE_WAIT = Duration.ofSeconds(10);

    private final CliContext context;

    @Parameters(index = "0", paramLabel = "ID", description = "Schedule id")
    String id;

    public CancelCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (context.scheduleService().cancel(id).isEmpty()) {
                System.err.println("No schedule with id " + id);
                return 1;
            }
            System.out.println("Cancelled schedule " + id);
            if (!context.scheduleService().awaitPendingNotices(NOTICE_WAIT)) {
                System.err.println("Cancellation notice still in flight after " + NOTICE_WAIT.toSeconds() + "s, it may not be sent");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Cancel command failed: " + e.getMessage());
            return 1;
        }
    }
}

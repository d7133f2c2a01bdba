package io.storvix.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "scheduler", description = "Run the pollers and the schedule HTTP API until stopped")
public final class SchedulerCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "API port override")
    Integer port;

    public SchedulerCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.schedulerRunner().run(port);
        } catch (Exception e) {
            System.err.println("Scheduler command failed: " + e.getMessage());
            return 1;
        }
    }
}

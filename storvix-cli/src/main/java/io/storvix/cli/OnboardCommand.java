package io.storvix.cli;

import io.storvix.core.config.OnboardResult;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write the config and lay out the scheduler workspace")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace the existing config with defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        OnboardResult result;
        try {
            result = context.configService().onboard(context.configPath(), overwrite);
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
        switch (result.action()) {
            case CREATED -> System.out.println("Created config: " + result.configPath());
            case OVERWRITTEN -> System.out.println("Overwrote config with defaults: " + result.configPath());
            case MERGED -> System.out.println("Refreshed config with new defaults: " + result.configPath());
        }
        System.out.println("Workspace ready: " + result.workspacePath());
        System.out.println("Schedule store (" + result.scheduleBackend() + "): " + result.scheduleStore());
        System.out.println("Users file: " + describe(result, result.usersFile()));
        System.out.println("Systems file: " + describe(result, result.systemsFile()));
        System.out.println("Reports directory: " + result.reportsDirectory());
        if (result.mailRelayConfigured()) {
            System.out.println("Mail relay: configured");
        } else {
            System.out.println("Mail relay: not configured, set mail.apiBase and STORVIX_MAIL_API_KEY to deliver reports");
        }
        return 0;
    }

    private static String describe(OnboardResult result, Path file) {
        return result.seededFiles().contains(file) ? file + " (created empty)" : file.toString();
    }
}

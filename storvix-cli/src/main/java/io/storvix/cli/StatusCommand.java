package io.storvix.cli;

import io.storvix.core.config.ConfigPaths;
import io.storvix.core.config.model.StorvixConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show effective configuration")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            StorvixConfig config = context.configService().loadEffective(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + ConfigPaths.resolveWorkspace(config.storage().workspace()));
            System.out.println("Storage backend: " + config.storage().backend());
            System.out.println("Report poll interval: " + config.scheduler().reportPollSeconds() + "s");
            System.out.println("Mail poll interval: " + config.scheduler().mailPollSeconds() + "s");
            System.out.println("Mail relay configured: " + config.mail().configured());
            System.out.println("Mail sender: " + config.mail().from());
            System.out.println("API: " + config.api().host() + ":" + config.api().port());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}

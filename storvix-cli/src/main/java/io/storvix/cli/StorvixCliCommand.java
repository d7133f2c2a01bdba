package io.storvix.cli;

import picocli.CommandLine.Command;

@Command(name = "storvix", mixinStandardHelpOptions = true, description = "Storvix report and notification scheduler")
public final class StorvixCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}

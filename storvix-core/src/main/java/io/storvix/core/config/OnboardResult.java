package io.storvix.core.config;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@code onboard}: what happened to the config file and where the scheduler keeps its
 * state. {@code seededFiles} lists the workspace files created empty by this run.
 */
public record OnboardResult(
    Path configPath,
    ConfigAction action,
    Path workspacePath,
    String scheduleBackend,
    Path scheduleStore,
    Path usersFile,
    Path systemsFile,
    Path reportsDirectory,
    List<Path> seededFiles,
    boolean mailRelayConfigured
) {
    public OnboardResult {
        seededFiles = seededFiles == null ? List.of() : List.copyOf(seededFiles);
    }

    public enum ConfigAction {
        CREATED,
        OVERWRITTEN,
        MERGED
    }
}

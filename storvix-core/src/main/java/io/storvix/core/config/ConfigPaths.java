package io.storvix.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".storvix", "config.json");
    }

    public static Path resolveWorkspace(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".storvix", "workspace");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path schedulesFile(Path workspace) {
        return workspace.resolve("schedules.json");
    }

    public static Path schedulesDatabase(Path workspace) {
        return workspace.resolve("schedules.db");
    }

    public static Path scheduleStore(Path workspace, boolean sqlite) {
        return sqlite ? schedulesDatabase(workspace) : schedulesFile(workspace);
    }

    public static Path systemsFile(Path workspace) {
        return workspace.resolve("systems.json");
    }

    public static Path usersFile(Path workspace) {
        return workspace.resolve("users.json");
    }

    public static Path reportsDirectory(Path workspace) {
        return workspace.resolve("reports");
    }
}

package io.storvix.core.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class WorkspaceBootstrap {

    private WorkspaceBootstrap() {
    }

    /**
     * Creates the workspace layout and seeds empty user and system inventories.
     * Existing files are left untouched.
     *
     * @return the files this call created
     */
    public static List<Path> ensureWorkspace(Path workspace) throws IOException {
        Files.createDirectories(workspace);
        Files.createDirectories(ConfigPaths.reportsDirectory(workspace));

        List<Path> seeded = new ArrayList<>();
        for (Path path : List.of(ConfigPaths.usersFile(workspace), ConfigPaths.systemsFile(workspace))) {
            if (!Files.exists(path)) {
                Files.writeString(path, "[]" + System.lineSeparator(), StandardCharsets.UTF_8);
                seeded.add(path);
            }
        }
        return seeded;
    }
}

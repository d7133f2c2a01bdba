package io.storvix.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String workspace,
    String backend
) {
    public static final String FILE = "file";
    public static final String SQLITE = "sqlite";

    public StorageConfig {
        backend = backend == null || backend.isBlank() ? FILE : backend.trim().toLowerCase(Locale.ROOT);
        if (!FILE.equals(backend) && !SQLITE.equals(backend)) {
            throw new IllegalArgumentException("storage.backend must be one of file, sqlite");
        }
    }

    public static StorageConfig defaults() {
        return new StorageConfig("~/.storvix/workspace", FILE);
    }

    public boolean sqlite() {
        return SQLITE.equals(backend);
    }
}

package io.storvix.core.fleet;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class FileFleetInventory implements FleetInventory {
    private final Path path;
    private final ObjectMapper mapper;

    public FileFleetInventory(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    @Override
    public synchronized List<StorageSystem> systems() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        String raw = Files.readString(path);
        if (raw.isBlank()) {
            return List.of();
        }
        return mapper.readValue(raw, new TypeReference<List<StorageSystem>>() {
        });
    }
}

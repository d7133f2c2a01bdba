package io.storvix.core.artifact;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.storvix.core.schedule.ReportPayload;
import io.storvix.core.schedule.ScheduledJob;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Writes report bytes under {@code <root>/files} and keeps their metadata in {@code <root>/index.json}.
 */
public final class FileReportArchive implements ReportArchive {
    private final Path root;
    private final Path index;
    private final ObjectMapper mapper;

    public FileReportArchive(Path root) {
        this.root = root;
        this.index = root.resolve("index.json");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized ArchivedReport store(ScheduledJob job, Artifact artifact, Instant createdAt) throws IOException {
        String id = UUID.randomUUID().toString();
        Path files = root.resolve("files");
        Files.createDirectories(files);
        String stored = id + "-" + artifact.filename().replaceAll("[^A-Za-z0-9._-]", "_");
        Files.write(files.resolve(stored), artifact.content());

        ReportPayload report = job.payload() instanceof ReportPayload payload ? payload : null;
        ArchivedReport entry = new ArchivedReport(
            id,
            job.id(),
            job.owner().userId(),
            job.owner().company(),
            report == null ? "" : report.target(),
            report == null ? List.of() : report.sections(),
            report == null ? null : report.format(),
            artifact.filename(),
            artifact.mimeType(),
            artifact.size(),
            "files/" + stored,
            createdAt
        );
        List<ArchivedReport> entries = new ArrayList<>(list());
        entries.add(entry);
        save(entries);
        return entry;
    }

    @Override
    public synchronized List<ArchivedReport> list() throws IOException {
        if (!Files.exists(index)) {
            return List.of();
        }
        return mapper.readValue(Files.readString(index), new TypeReference<List<ArchivedReport>>() {
        });
    }

    private void save(List<ArchivedReport> entries) throws IOException {
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(entries);
        Path tmp = index.resolveSibling(index.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, index, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}

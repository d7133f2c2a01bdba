package io.storvix.core.schedule.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.ScheduledJob;
import io.storvix.core.schedule.ScheduledJobValidator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps every job of both classes in one JSON array. Each write rewrites the whole document
 * through a temp file and an atomic move.
 */
public final class FileScheduleRepository implements ScheduleRepository {
    private static final Logger LOG = LoggerFactory.getLogger(FileScheduleRepository.class);

    private final Path path;
    private final ObjectMapper mapper;

    public FileScheduleRepository(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        this.path = path;
        this.mapper = ScheduleJson.mapper();
    }

    @Override
    public synchronized void insert(ScheduledJob job) throws IOException {
        ScheduledJobValidator.validate(job);
        Snapshot snapshot = load();
        List<ScheduledJob> jobs = new ArrayList<>(snapshot.jobs());
        if (jobs.stream().anyMatch(existing -> existing.id().equals(job.id()))) {
            throw new IOException("Schedule already exists: " + job.id());
        }
        jobs.add(job);
        save(jobs, snapshot.unreadable());
    }

    @Override
    public synchronized Optional<ScheduledJob> findById(String id) throws IOException {
        return load().jobs().stream().filter(job -> job.id().equals(id)).findFirst();
    }

    @Override
    public synchronized List<ScheduledJob> findByKind(JobKind kind) throws IOException {
        return load().jobs().stream().filter(job -> job.kind() == kind).toList();
    }

    @Override
    public synchronized List<ScheduledJob> findDue(JobKind kind, Instant now) throws IOException {
        return load().jobs().stream()
            .filter(job -> job.kind() == kind)
            .filter(job -> job.isDueAt(now))
            .toList();
    }

    @Override
    public synchronized boolean update(ScheduledJob job) throws IOException {
        ScheduledJobValidator.validate(job);
        Snapshot snapshot = load();
        List<ScheduledJob> jobs = new ArrayList<>(snapshot.jobs());
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).id().equals(job.id())) {
                jobs.set(i, job);
                save(jobs, snapshot.unreadable());
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized boolean delete(String id) throws IOException {
        Snapshot snapshot = load();
        List<ScheduledJob> jobs = new ArrayList<>(snapshot.jobs());
        List<JsonNode> unreadable = new ArrayList<>(snapshot.unreadable());
        boolean removed = jobs.removeIf(job -> job.id().equals(id));
        removed |= unreadable.removeIf(node -> id.equals(node.path("id").asText(null)));
        if (removed) {
            save(jobs, unreadable);
        }
        return removed;
    }

    private Snapshot load() throws IOException {
        if (!Files.exists(path)) {
            return Snapshot.EMPTY;
        }
        JsonNode root = mapper.readTree(Files.readString(path));
        if (root == null || !root.isArray()) {
            return Snapshot.EMPTY;
        }
        List<ScheduledJob> jobs = new ArrayList<>();
        List<JsonNode> unreadable = new ArrayList<>();
        for (JsonNode node : root) {
            try {
                jobs.add(ScheduledJobValidator.validate(mapper.treeToValue(node, ScheduledJob.class)));
            } catch (IllegalArgumentException | IOException e) {
                // kept verbatim on every rewrite, never scheduled
                LOG.warn("Skipping invalid schedule record {} in {}: {}", node.path("id").asText("?"), path, e.getMessage());
                unreadable.add(node);
            }
        }
        return new Snapshot(jobs, unreadable);
    }

    private void save(List<ScheduledJob> jobs, List<JsonNode> unreadable) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        ArrayNode root = mapper.createArrayNode();
        for (ScheduledJob job : jobs) {
            root.add(mapper.valueToTree(job));
        }
        root.addAll(unreadable);
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private record Snapshot(List<ScheduledJob> jobs, List<JsonNode> unreadable) {
        private static final Snapshot EMPTY = new Snapshot(List.of(), List.of());
    }
}

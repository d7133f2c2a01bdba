package io.storvix.core.schedule.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.ScheduledJob;
import io.storvix.core.schedule.ScheduledJobValidator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqliteScheduleRepository implements ScheduleRepository {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteScheduleRepository.class);

    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteScheduleRepository(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = ScheduleJson.mapper();
        init();
    }

    @Override
    public synchronized void insert(ScheduledJob job) throws IOException {
        ScheduledJobValidator.validate(job);
        String sql = """
            INSERT INTO scheduled_jobs (id, kind, owner_id, company, next_run_at_ms, job_json)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, job.id());
            statement.setString(2, job.kind().wireName());
            statement.setString(3, job.owner().userId());
            statement.setString(4, job.owner().company());
            bindNextRun(statement, 5, job.nextRunAt());
            statement.setString(6, mapper.writeValueAsString(job));
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to insert schedule " + job.id(), e);
        }
    }

    @Override
    public synchronized Optional<ScheduledJob> findById(String id) throws IOException {
        String sql = "SELECT id, job_json FROM scheduled_jobs WHERE id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, id);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ScheduledJob> jobs = readAll(resultSet);
                return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read schedule " + id, e);
        }
    }

    @Override
    public synchronized List<ScheduledJob> findByKind(JobKind kind) throws IOException {
        String sql = """
            SELECT id, job_json
            FROM scheduled_jobs
            WHERE kind = ?
            ORDER BY rowid ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, kind.wireName());
            try (ResultSet resultSet = statement.executeQuery()) {
                return readAll(resultSet);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list " + kind.wireName() + " schedules", e);
        }
    }

    @Override
    public synchronized List<ScheduledJob> findDue(JobKind kind, Instant now) throws IOException {
        String sql = """
            SELECT id, job_json
            FROM scheduled_jobs
            WHERE kind = ? AND next_run_at_ms IS NOT NULL AND next_run_at_ms <= ?
            ORDER BY next_run_at_ms ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, kind.wireName());
            statement.setLong(2, now.toEpochMilli());
            try (ResultSet resultSet = statement.executeQuery()) {
                // the column is millisecond precision, the record is not
                return readAll(resultSet).stream().filter(job -> job.isDueAt(now)).toList();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to select due " + kind.wireName() + " schedules", e);
        }
    }

    @Override
    public synchronized boolean update(ScheduledJob job) throws IOException {
        ScheduledJobValidator.validate(job);
        String sql = """
            UPDATE scheduled_jobs
            SET kind = ?, owner_id = ?, company = ?, next_run_at_ms = ?, job_json = ?
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, job.kind().wireName());
            statement.setString(2, job.owner().userId());
            statement.setString(3, job.owner().company());
            bindNextRun(statement, 4, job.nextRunAt());
            statement.setString(5, mapper.writeValueAsString(job));
            statement.setString(6, job.id());
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to update schedule " + job.id(), e);
        }
    }

    @Override
    public synchronized boolean delete(String id) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM scheduled_jobs WHERE id = ?")) {
            statement.setString(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete schedule " + id, e);
        }
    }

    private List<ScheduledJob> readAll(ResultSet resultSet) throws SQLException {
        List<ScheduledJob> jobs = new ArrayList<>();
        while (resultSet.next()) {
            String id = resultSet.getString("id");
            try {
                ScheduledJob job = mapper.readValue(resultSet.getString("job_json"), ScheduledJob.class);
                jobs.add(ScheduledJobValidator.validate(job));
            } catch (IllegalArgumentException | IOException e) {
                LOG.warn("Skipping invalid schedule row {}: {}", id, e.getMessage());
            }
        }
        return jobs;
    }

    private void bindNextRun(PreparedStatement statement, int index, Instant nextRunAt) throws SQLException {
        if (nextRunAt == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, nextRunAt.toEpochMilli());
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS scheduled_jobs (
                id TEXT PRIMARY KEY,
                kind TEXT NOT NULL,
                owner_id TEXT NOT NULL,
                company TEXT NOT NULL,
                next_run_at_ms INTEGER,
                job_json TEXT NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_scheduled_jobs_due
            ON scheduled_jobs(kind, next_run_at_ms)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite schedule store", e);
        }
    }
}

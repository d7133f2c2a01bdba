package io.storvix.core.schedule.store;

import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.ScheduledJob;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleRepository {
    void insert(ScheduledJob job) throws IOException;

    Optional<ScheduledJob> findById(String id) throws IOException;

    List<ScheduledJob> findByKind(JobKind kind) throws IOException;

    List<ScheduledJob> findDue(JobKind kind, Instant now) throws IOException;

    /**
     * Replaces the stored record with the same id.
     *
     * @return {@code false} when no such record exists
     */
    boolean update(ScheduledJob job) throws IOException;

    boolean delete(String id) throws IOException;
}

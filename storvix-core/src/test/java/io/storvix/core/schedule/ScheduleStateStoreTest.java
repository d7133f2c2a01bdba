package io.storvix.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.storvix.core.schedule.store.FileScheduleRepository;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScheduleStateStoreTest {
    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    @TempDir
    Path tempDir;

    private ScheduleStateStore store;

    @BeforeEach
    void setUp() {
        store = new ScheduleStateStore(new FileScheduleRepository(tempDir.resolve("schedules.json")));
    }

    @Test
    void shouldStartWithNextRunAtFirstRun() throws Exception {
        ScheduledJob input = new ScheduledJob(
            "r-1", ScheduleFixtures.OWNER,
            new ReportPayload("host-1", java.util.List.of(), ReportFormat.XLSX),
            Frequency.DAILY, null, T0, null, T0.minusSeconds(5), T0
        );

        ScheduledJob created = store.create(input);

        assertThat(created.nextRunAt()).isEqualTo(T0);
        assertThat(created.lastRunAt()).isNull();
        assertThat(store.get("r-1")).contains(created);
    }

    @Test
    void shouldOnlySelectJobsDueAtTheGivenInstant() throws Exception {
        store.create(ScheduleFixtures.reportJob("due", Frequency.DAILY, null, T0));
        store.create(ScheduleFixtures.reportJob("later", Frequency.DAILY, null, T0.plusSeconds(60)));
        store.create(ScheduleFixtures.mailJob("mail", Frequency.DAILY, null, T0));

        assertThat(store.findDue(JobKind.REPORT, T0)).extracting(ScheduledJob::id).containsExactly("due");
        assertThat(store.findDue(JobKind.MAIL, T0)).extracting(ScheduledJob::id).containsExactly("mail");
    }

    @Test
    void shouldAdvanceWithNextTime() throws Exception {
        store.create(ScheduleFixtures.reportJob("r-1", Frequency.HOURLY, null, T0));
        Instant now = T0.plusSeconds(30);

        AdvanceOutcome outcome = store.advanceOrRetire("r-1", now, Optional.of(now.plus(Duration.ofHours(1))));

        assertThat(outcome).isEqualTo(AdvanceOutcome.ADVANCED);
        ScheduledJob stored = store.get("r-1").orElseThrow();
        assertThat(stored.lastRunAt()).isEqualTo(now);
        assertThat(stored.nextRunAt()).isEqualTo(now.plus(Duration.ofHours(1)));
        assertThat(store.findDue(JobKind.REPORT, now)).isEmpty();
    }

    @Test
    void shouldKeepCompletedReportJobsWithoutNextRun() throws Exception {
        store.create(ScheduleFixtures.reportJob("r-once", Frequency.ONCE, null, T0));

        AdvanceOutcome outcome = store.advanceOrRetire("r-once", T0, Optional.empty());

        assertThat(outcome).isEqualTo(AdvanceOutcome.COMPLETED);
        ScheduledJob stored = store.get("r-once").orElseThrow();
        assertThat(stored.nextRunAt()).isNull();
        assertThat(stored.lastRunAt()).isEqualTo(T0);
        assertThat(store.findDue(JobKind.REPORT, T0.plus(Duration.ofDays(365)))).isEmpty();
    }

    @Test
    void shouldDeleteCompletedMailJobs() throws Exception {
        store.create(ScheduleFixtures.mailJob("m-once", Frequency.ONCE, null, T0));

        AdvanceOutcome outcome = store.advanceOrRetire("m-once", T0, Optional.empty());

        assertThat(outcome).isEqualTo(AdvanceOutcome.DELETED);
        assertThat(store.get("m-once")).isEmpty();
        assertThat(store.list(JobKind.MAIL)).isEmpty();
    }

    @Test
    void shouldRefuseNextTimeThatIsNotAfterNow() throws Exception {
        store.create(ScheduleFixtures.reportJob("r-1", Frequency.HOURLY, null, T0));

        assertThatThrownBy(() -> store.advanceOrRetire("r-1", T0, Optional.of(T0)))
            .isInstanceOf(IllegalStateException.class);
        assertThat(store.get("r-1").orElseThrow().nextRunAt()).isEqualTo(T0);
    }

    @Test
    void shouldReportMissingWhenJobWasCancelledMidTick() throws Exception {
        store.create(ScheduleFixtures.reportJob("r-1", Frequency.DAILY, null, T0));
        assertThat(store.cancel("r-1")).isPresent();

        assertThat(store.advanceOrRetire("r-1", T0, Optional.of(T0.plus(Duration.ofDays(1)))))
            .isEqualTo(AdvanceOutcome.MISSING);
        assertThat(store.get("r-1")).isEmpty();
    }

    @Test
    void shouldCancelEitherClass() throws Exception {
        store.create(ScheduleFixtures.reportJob("r-1", Frequency.DAILY, null, T0));
        store.create(ScheduleFixtures.mailJob("m-1", Frequency.DAILY, null, T0));

        assertThat(store.cancel("r-1")).map(ScheduledJob::id).contains("r-1");
        assertThat(store.cancel("m-1")).map(ScheduledJob::id).contains("m-1");
        assertThat(store.cancel("m-1")).isEmpty();
        assertThat(store.findDue(JobKind.REPORT, T0)).isEmpty();
        assertThat(store.findDue(JobKind.MAIL, T0)).isEmpty();
    }

    @Test
    void shouldRejectCustomJobWithoutInterval() {
        assertThatThrownBy(() -> store.create(ScheduleFixtures.reportJob("r-1", Frequency.CUSTOM, null, T0)))
            .isInstanceOf(InvalidScheduleException.class)
            .hasMessageContaining("customInterval");
    }
}

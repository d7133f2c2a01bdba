package io.storvix.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.storvix.core.artifact.Artifact;
import io.storvix.core.artifact.ArtifactProducer;
import io.storvix.core.artifact.ArtifactProductionException;
import io.storvix.core.artifact.FileReportArchive;
import io.storvix.core.delivery.DeliveryResult;
import io.storvix.core.delivery.MailMessage;
import io.storvix.core.delivery.RecordingDeliveryAgent;
import io.storvix.core.directory.UserAccount;
import io.storvix.core.directory.UserAccountStore;
import io.storvix.core.directory.UserDirectory;
import io.storvix.core.schedule.AdvanceOutcome;
import io.storvix.core.schedule.Frequency;
import io.storvix.core.schedule.FrequencyResolver;
import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.MailPayload;
import io.storvix.core.schedule.ReportFormat;
import io.storvix.core.schedule.ReportPayload;
import io.storvix.core.schedule.ScheduleFixtures;
import io.storvix.core.schedule.ScheduleRequest;
import io.storvix.core.schedule.ScheduleService;
import io.storvix.core.schedule.ScheduleStateStore;
import io.storvix.core.schedule.ScheduledJob;
import io.storvix.core.schedule.store.FileScheduleRepository;
import io.storvix.core.schedule.store.ScheduleRepository;
import io.storvix.core.subscription.SubscriptionSweeper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchedulePollerTest {
    private static final Instant T0 = Instant.parse("2024-07-01T06:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FileScheduleRepository repository;
    private ScheduleStateStore store;
    private RecordingDeliveryAgent delivery;
    private FileReportArchive archive;
    private final UserDirectory directory = userId -> Optional.of(userId + "@acme.test");
    private final ArtifactProducer producer = (target, sections, format) -> {
        if ("broken".equals(target)) {
            throw new ArtifactProductionException("renderer crashed");
        }
        String name = ReportPayload.ALL_SYSTEMS.equals(target) ? "report" : target + "-report";
        return new Artifact(("%PDF " + target).getBytes(StandardCharsets.UTF_8), name + "." + format.extension(), format.mimeType());
    };

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        repository = new FileScheduleRepository(tempDir.resolve("schedules.json"));
        store = new ScheduleStateStore(repository);
        delivery = new RecordingDeliveryAgent();
        archive = new FileReportArchive(tempDir.resolve("reports"));
    }

    @Test
    void shouldIsolateProductionFailureWithinBatch() throws Exception {
        store.create(ScheduleFixtures.reportJob("r-1", "host-1", Frequency.DAILY, null, T0));
        store.create(ScheduleFixtures.reportJob("r-2", "broken", Frequency.DAILY, null, T0));
        store.create(ScheduleFixtures.reportJob("r-3", "host-3", Frequency.DAILY, null, T0));
        SchedulePoller poller = poller(null, Duration.ofSeconds(2));

        TickReport report = poller.tick();

        assertThat(report.due()).isEqualTo(3);
        assertThat(report.outcomes()).extracting(JobOutcome::jobId, JobOutcome::delivered)
            .containsExactlyInAnyOrder(
                tuple("r-1", true),
                tuple("r-2", false),
                tuple("r-3", true)
            );
        assertThat(report.count(AdvanceOutcome.ADVANCED)).isEqualTo(3);
        for (String id : List.of("r-1", "r-2", "r-3")) {
            assertThat(store.get(id).orElseThrow().nextRunAt()).isEqualTo(T0.plus(Duration.ofHours(24)));
        }
        assertThat(delivery.sent()).extracting(MailMessage::subject)
            .containsExactlyInAnyOrder("Scheduled Report for system host-1", "Scheduled Report for system host-3");
        assertThat(archive.list()).hasSize(2);

        assertThat(poller.tick().due()).isZero();
    }

    @Test
    void shouldMailReportToOwnerWithAttachment() throws Exception {
        store.create(ScheduleFixtures.reportJob("r-all", ReportPayload.ALL_SYSTEMS, Frequency.HOURLY, null, T0));

        poller(null, Duration.ofSeconds(2)).tick();

        MailMessage sent = delivery.sent().get(0);
        assertThat(sent.to()).containsExactly("u-1@acme.test");
        assertThat(sent.subject()).isEqualTo("Scheduled Aggregated Report");
        assertThat(sent.textBody()).isEqualTo("Attached is your scheduled report generated at 2024-07-01 06:00 UTC.");
        assertThat(sent.attachment().filename()).isEqualTo("report.pdf");
        assertThat(archive.list()).singleElement().satisfies(entry -> {
            assertThat(entry.scheduleId()).isEqualTo("r-all");
            assertThat(entry.target()).isEqualTo("all");
        });
    }

    @Test
    void shouldRunDailyJobOncePerDay() throws Exception {
        ScheduleService service = new ScheduleService(store, new FrequencyResolver(), directory, delivery, clock);
        ScheduledJob job = service.schedule(new ScheduleRequest(
            ScheduleFixtures.OWNER,
            new ReportPayload("host-1", List.of(), ReportFormat.PDF),
            "daily",
            null,
            null
        ));
        SchedulePoller poller = poller(null, Duration.ofSeconds(2));

        clock.set(T0.plus(Duration.ofMinutes(1)));
        assertThat(poller.tick().due()).isEqualTo(1);
        ScheduledJob afterFirst = store.get(job.id()).orElseThrow();
        assertThat(afterFirst.lastRunAt()).isEqualTo(T0.plus(Duration.ofMinutes(1)));
        assertThat(afterFirst.nextRunAt()).isEqualTo(T0.plus(Duration.ofMinutes(1)).plus(Duration.ofHours(24)));

        clock.set(T0.plus(Duration.ofHours(23)));
        assertThat(poller.tick().due()).isZero();

        clock.set(T0.plus(Duration.ofHours(24)).plus(Duration.ofMinutes(1)));
        assertThat(poller.tick().outcomes()).extracting(JobOutcome::jobId).containsExactly(job.id());
    }

    @Test
    void shouldScheduleCustomMailInDaysAndStopAfterCancel() throws Exception {
        ScheduleService service = new ScheduleService(store, new FrequencyResolver(), directory, delivery, clock);
        ScheduledJob job = service.schedule(new ScheduleRequest(
            ScheduleFixtures.OWNER,
            MailPayload.plain(List.of("ops@acme.test"), "Digest", "<p>Fleet digest</p>"),
            "custom",
            48.0,
            null
        ));
        SchedulePoller poller = poller(null, Duration.ofSeconds(2));

        poller.tick();

        assertThat(store.get(job.id()).orElseThrow().nextRunAt()).isEqualTo(T0.plus(Duration.ofDays(48)));
        assertThat(service.cancel(job.id())).isPresent();

        clock.set(T0.plus(Duration.ofDays(49)));
        assertThat(poller.tick().due()).isZero();
        assertThat(store.list(JobKind.MAIL)).isEmpty();
    }

    @Test
    void shouldRetireOneShotJobsByClass() throws Exception {
        store.create(ScheduleFixtures.reportJob("r-once", Frequency.ONCE, null, T0));
        store.create(ScheduleFixtures.mailJob("m-once", Frequency.ONCE, null, T0));

        TickReport report = poller(null, Duration.ofSeconds(2)).tick();

        assertThat(report.count(AdvanceOutcome.COMPLETED)).isEqualTo(1);
        assertThat(report.count(AdvanceOutcome.DELETED)).isEqualTo(1);
        ScheduledJob retained = store.get("r-once").orElseThrow();
        assertThat(retained.nextRunAt()).isNull();
        assertThat(retained.lastRunAt()).isEqualTo(T0);
        assertThat(store.get("m-once")).isEmpty();
    }

    @Test
    void shouldComposeMailBodiesWithSummaryAndPlainTextAlternative() throws Exception {
        MailPayload summary = new MailPayload(
            List.of("ops@acme.test"), "", "<p>stored body</p>", true, "host-2", List.of(), ReportFormat.XLSX, true, List.of("Acme")
        );
        store.create(new ScheduledJob("m-1", ScheduleFixtures.OWNER, summary, Frequency.WEEKLY, null, T0, T0, null, T0));
        List<List<String>> requestedCompanies = new ArrayList<>();
        MailJobHandler handler = new MailJobHandler(producer, companies -> {
            requestedCompanies.add(companies);
            return "<h3>Critical</h3><p>Acme array-1: 95.0% used</p>";
        }, delivery);
        SchedulePoller poller = new SchedulePoller("mail", List.of(handler), store, new FrequencyResolver(), null, clock, Duration.ofSeconds(2));

        poller.tick();

        MailMessage sent = delivery.sent().get(0);
        assertThat(requestedCompanies).containsExactly(List.of("Acme"));
        assertThat(sent.subject()).isEqualTo(MailJobHandler.DEFAULT_SUBJECT);
        assertThat(sent.htmlBody()).contains("<h3>Critical</h3>");
        assertThat(sent.textBody()).isEqualTo("Critical\nAcme array-1: 95.0% used");
        assertThat(sent.attachment().filename()).isEqualTo("host-2-report.xlsx");
        assertThat(sent.attachment().mimeType()).isEqualTo(ReportFormat.XLSX.mimeType());
    }

    @Test
    void shouldFallBackToStoredBodyWhenSummaryFails() throws Exception {
        MailPayload summary = new MailPayload(
            List.of("ops@acme.test"), "Status", "<p>stored body</p>", false, "", List.of(), null, true, List.of()
        );
        store.create(new ScheduledJob("m-1", ScheduleFixtures.OWNER, summary, Frequency.DAILY, null, T0, T0, null, T0));
        MailJobHandler handler = new MailJobHandler(producer, companies -> {
            throw new IOException("inventory unavailable");
        }, delivery);
        SchedulePoller poller = new SchedulePoller("mail", List.of(handler), store, new FrequencyResolver(), null, clock, Duration.ofSeconds(2));

        TickReport report = poller.tick();

        assertThat(report.delivered()).isEqualTo(1);
        assertThat(delivery.sent().get(0).textBody()).isEqualTo("stored body");
        assertThat(delivery.sent().get(0).attachment()).isNull();
    }

    @Test
    void shouldLeaveJobDueWhenScheduleWriteFails() throws Exception {
        FlakyRepository flaky = new FlakyRepository(repository, 1);
        store = new ScheduleStateStore(flaky);
        store.create(ScheduleFixtures.reportJob("r-1", Frequency.HOURLY, null, T0));
        store.create(ScheduleFixtures.reportJob("r-2", Frequency.HOURLY, null, T0));
        SchedulePoller poller = poller(null, Duration.ofSeconds(2));

        TickReport first = poller.tick();

        assertThat(first.retryPending()).isEqualTo(1);
        assertThat(first.count(AdvanceOutcome.ADVANCED)).isEqualTo(1);
        assertThat(store.findDue(JobKind.REPORT, T0)).hasSize(1);

        TickReport second = poller.tick();
        assertThat(second.due()).isEqualTo(1);
        assertThat(second.count(AdvanceOutcome.ADVANCED)).isEqualTo(1);
        assertThat(store.findDue(JobKind.REPORT, T0)).isEmpty();
        assertThat(delivery.sent()).hasSize(3);
    }

    @Test
    void shouldKeepProcessingJobsWhenSweepFails() throws Exception {
        store.create(ScheduleFixtures.reportJob("r-1", Frequency.DAILY, null, T0));
        SubscriptionSweeper sweeper = new SubscriptionSweeper(new UserAccountStore() {
            @Override
            public List<UserAccount> load() throws IOException {
                throw new IOException("users unavailable");
            }

            @Override
            public void save(List<UserAccount> accounts) {
            }
        });

        TickReport report = poller(sweeper, Duration.ofSeconds(2)).tick();

        assertThat(report.sweepFailure()).isEqualTo("users unavailable");
        assertThat(report.delivered()).isEqualTo(1);
        assertThat(report.count(AdvanceOutcome.ADVANCED)).isEqualTo(1);
    }

    @Test
    void shouldSweepExpiredSubscriptionsOncePerTick() throws Exception {
        List<List<UserAccount>> saved = new ArrayList<>();
        SubscriptionSweeper sweeper = new SubscriptionSweeper(new UserAccountStore() {
            @Override
            public List<UserAccount> load() {
                return List.of(new UserAccount("u-1", "alice", "a@acme.test", "Acme", "Pro", T0.minusSeconds(1)));
            }

            @Override
            public void save(List<UserAccount> accounts) {
                saved.add(accounts);
            }
        });

        TickReport report = poller(sweeper, Duration.ofSeconds(2)).tick();

        assertThat(report.expiredSubscriptions()).isEqualTo(1);
        assertThat(report.due()).isZero();
        assertThat(saved).singleElement().satisfies(accounts ->
            assertThat(accounts.get(0).subscription()).isEqualTo(SubscriptionSweeper.NO_SUBSCRIPTION));
    }

    @Test
    void shouldTreatSlowDeliveryAsFailureAndStillAdvance() throws Exception {
        delivery = new RecordingDeliveryAgent(message -> new CompletableFuture<>());
        store.create(ScheduleFixtures.mailJob("m-1", Frequency.HOURLY, null, T0));

        TickReport report = poller(null, Duration.ofMillis(200)).tick();

        assertThat(report.outcomes()).singleElement().satisfies(outcome -> {
            assertThat(outcome.delivered()).isFalse();
            assertThat(outcome.failure()).isEqualTo("delivery timed out");
            assertThat(outcome.advance()).isEqualTo(AdvanceOutcome.ADVANCED);
        });
        assertThat(store.get("m-1").orElseThrow().nextRunAt()).isEqualTo(T0.plus(Duration.ofHours(1)));
    }

    @Test
    void shouldAdvanceAfterRejectedDelivery() throws Exception {
        delivery = new RecordingDeliveryAgent(message -> CompletableFuture.completedFuture(DeliveryResult.failed("http 550")));
        store.create(ScheduleFixtures.mailJob("m-1", Frequency.DAILY, null, T0));

        TickReport report = poller(null, Duration.ofSeconds(2)).tick();

        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.outcomes().get(0).failure()).isEqualTo("http 550");
        assertThat(store.findDue(JobKind.MAIL, T0)).isEmpty();
    }

    @Test
    void shouldProcessReadableClassWhenOtherClassCannotBeRead() throws Exception {
        store = new ScheduleStateStore(new FlakyRepository(repository, 0) {
            @Override
            public List<ScheduledJob> findDue(JobKind kind, Instant now) throws IOException {
                if (kind == JobKind.MAIL) {
                    throw new IOException("mail collection offline");
                }
                return super.findDue(kind, now);
            }
        });
        store.create(ScheduleFixtures.reportJob("r-1", Frequency.DAILY, null, T0));
        store.create(ScheduleFixtures.mailJob("m-1", Frequency.DAILY, null, T0));

        TickReport report = poller(null, Duration.ofSeconds(2)).tick();

        assertThat(report.unreadableKinds()).containsExactly(JobKind.MAIL);
        assertThat(report.outcomes()).extracting(JobOutcome::jobId).containsExactly("r-1");
    }

    @Test
    void shouldTickOnScheduleAndStopOnClose() throws Exception {
        store.create(ScheduleFixtures.mailJob("m-1", Frequency.HOURLY, null, T0));
        SchedulePoller poller = poller(null, Duration.ofSeconds(2));

        poller.start(Duration.ZERO, Duration.ofMillis(50));
        long deadline = System.currentTimeMillis() + 5_000;
        while (poller.lastReport().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        poller.close();

        assertThat(poller.lastReport()).isPresent();
        assertThat(poller.state()).isEqualTo(PollerState.IDLE);
        assertThat(delivery.sent()).hasSize(1);
    }

    private SchedulePoller poller(SubscriptionSweeper sweeper, Duration deliveryTimeout) {
        return new SchedulePoller(
            "test",
            List.of(
                new ReportJobHandler(producer, archive, directory, delivery),
                new MailJobHandler(producer, companies -> "<p>summary</p>", delivery)
            ),
            store,
            new FrequencyResolver(),
            sweeper,
            clock,
            deliveryTimeout
        );
    }

    private static class FlakyRepository implements ScheduleRepository {
        private final ScheduleRepository delegate;
        private final AtomicInteger failuresLeft;

        FlakyRepository(ScheduleRepository delegate, int updateFailures) {
            this.delegate = delegate;
            this.failuresLeft = new AtomicInteger(updateFailures);
        }

        @Override
        public void insert(ScheduledJob job) throws IOException {
            delegate.insert(job);
        }

        @Override
        public Optional<ScheduledJob> findById(String id) throws IOException {
            return delegate.findById(id);
        }

        @Override
        public List<ScheduledJob> findByKind(JobKind kind) throws IOException {
            return delegate.findByKind(kind);
        }

        @Override
        public List<ScheduledJob> findDue(JobKind kind, Instant now) throws IOException {
            return delegate.findDue(kind, now);
        }

        @Override
        public boolean update(ScheduledJob job) throws IOException {
            if (failuresLeft.getAndDecrement() > 0) {
                throw new IOException("disk full");
            }
            return delegate.update(job);
        }

        @Override
        public boolean delete(String id) throws IOException {
            return delegate.delete(id);
        }
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void set(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

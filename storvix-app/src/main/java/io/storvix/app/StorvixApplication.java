package io.storvix.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.storvix.cli.CancelCommand;
import io.storvix.cli.CliContext;
import io.storvix.cli.OnboardCommand;
import io.storvix.cli.SchedulerCommand;
import io.storvix.cli.SchedulesCommand;
import io.storvix.cli.StatusCommand;
import io.storvix.cli.StorvixCliCommand;
import io.storvix.cli.TickCommand;
import io.storvix.core.api.ScheduleApiServer;
import io.storvix.core.artifact.FileReportArchive;
import io.storvix.core.artifact.FleetReportProducer;
import io.storvix.core.artifact.TimeBoundArtifactProducer;
import io.storvix.core.config.ConfigPaths;
import io.storvix.core.config.ConfigService;
import io.storvix.core.config.model.StorvixConfig;
import io.storvix.core.delivery.DeliveryAgent;
import io.storvix.core.delivery.DisabledDeliveryAgent;
import io.storvix.core.delivery.HttpMailDeliveryAgent;
import io.storvix.core.directory.AccountDirectory;
import io.storvix.core.directory.FileUserAccountStore;
import io.storvix.core.fleet.FileFleetInventory;
import io.storvix.core.fleet.FleetInventory;
import io.storvix.core.fleet.FleetSummaryComposer;
import io.storvix.core.schedule.FrequencyResolver;
import io.storvix.core.schedule.ScheduleService;
import io.storvix.core.schedule.ScheduleStateStore;
import io.storvix.core.schedule.store.FileScheduleRepository;
import io.storvix.core.schedule.store.ScheduleRepository;
import io.storvix.core.schedule.store.SqliteScheduleRepository;
import io.storvix.core.scheduler.MailJobHandler;
import io.storvix.core.scheduler.ReportJobHandler;
import io.storvix.core.scheduler.SchedulePoller;
import io.storvix.core.scheduler.TickReport;
import io.storvix.core.subscription.SubscriptionSweeper;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class StorvixApplication {
    private static final Logger LOG = LoggerFactory.getLogger(StorvixApplication.class);
    // both pollers drain one after the other, each for up to 30s
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(65);

    private StorvixApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        StorvixConfig config = loadConfig(configService, configPath);
        Clock clock = Clock.systemUTC();

        Path workspace = ConfigPaths.resolveWorkspace(config.storage().workspace());
        ScheduleStateStore store = new ScheduleStateStore(buildRepository(config, workspace));
        FrequencyResolver resolver = new FrequencyResolver();
        FileUserAccountStore accounts = new FileUserAccountStore(ConfigPaths.usersFile(workspace));
        AccountDirectory directory = new AccountDirectory(accounts);
        DeliveryAgent delivery = buildDeliveryAgent(config);
        ScheduleService scheduleService = new ScheduleService(store, resolver, directory, delivery, clock);

        FleetInventory inventory = new FileFleetInventory(ConfigPaths.systemsFile(workspace));
        TimeBoundArtifactProducer producer = new TimeBoundArtifactProducer(
            new FleetReportProducer(inventory, clock),
            Duration.ofSeconds(config.artifacts().productionTimeoutSeconds())
        );
        // a job's delivery deadline counts from the start of its production
        Duration deliveryTimeout = Duration.ofSeconds(
            (long) config.artifacts().productionTimeoutSeconds() + config.mail().sendTimeoutSeconds()
        );

        SchedulePoller reportPoller = new SchedulePoller(
            "reports",
            List.of(new ReportJobHandler(producer, new FileReportArchive(ConfigPaths.reportsDirectory(workspace)), directory, delivery)),
            store,
            resolver,
            new SubscriptionSweeper(accounts),
            clock,
            deliveryTimeout
        );
        SchedulePoller mailPoller = new SchedulePoller(
            "mail",
            List.of(new MailJobHandler(producer, new FleetSummaryComposer(inventory, clock), delivery)),
            store,
            resolver,
            null,
            clock,
            deliveryTimeout
        );

        CliContext context = new CliContext(
            configService,
            configPath,
            scheduleService,
            () -> tickAll(List.of(reportPoller, mailPoller)),
            portOverride -> runScheduler(config, portOverride, scheduleService, reportPoller, mailPoller)
        );

        CommandLine commandLine = new CommandLine(new StorvixCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("schedules", new SchedulesCommand(context));
        commandLine.addSubcommand("cancel", new CancelCommand(context));
        commandLine.addSubcommand("tick", new TickCommand(context));
        commandLine.addSubcommand("scheduler", new SchedulerCommand(context));

        int exitCode;
        try {
            exitCode = commandLine.execute(args);
        } finally {
            producer.close();
        }
        System.exit(exitCode);
    }

    private static StorvixConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.loadEffective(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return StorvixConfig.defaults();
        }
    }

    private static ScheduleRepository buildRepository(StorvixConfig config, Path workspace) {
        Path location = ConfigPaths.scheduleStore(workspace, config.storage().sqlite());
        if (!config.storage().sqlite()) {
            return new FileScheduleRepository(location);
        }
        try {
            return new SqliteScheduleRepository(location);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize SQLite schedule store at " + location, e);
        }
    }

    private static DeliveryAgent buildDeliveryAgent(StorvixConfig config) {
        if (config.mail().configured()) {
            return HttpMailDeliveryAgent.fromConfig(config.mail(), new ObjectMapper());
        }
        return new DisabledDeliveryAgent("mail relay is not configured");
    }

    private static int runScheduler(
        StorvixConfig config,
        Integer portOverride,
        ScheduleService scheduleService,
        SchedulePoller reportPoller,
        SchedulePoller mailPoller
    ) throws Exception {
        int port = portOverride == null ? config.api().port() : portOverride;
        Duration initialDelay = Duration.ofSeconds(config.scheduler().initialDelaySeconds());
        List<SchedulePoller> pollers = List.of(reportPoller, mailPoller);

        SchedulerShutdown shutdown = new SchedulerShutdown(SHUTDOWN_GRACE);
        Runtime.getRuntime().addShutdownHook(shutdown.hook());
        List<SchedulePoller> started = new ArrayList<>();
        try (ScheduleApiServer server = new ScheduleApiServer(port, config.api().host(), scheduleService, pollers)) {
            server.start();
            reportPoller.start(initialDelay, Duration.ofSeconds(config.scheduler().reportPollSeconds()));
            started.add(reportPoller);
            mailPoller.start(initialDelay, Duration.ofSeconds(config.scheduler().mailPollSeconds()));
            started.add(mailPoller);
            System.out.println("Scheduler started on http://127.0.0.1:" + server.port());
            System.out.println("Endpoints: /api/reports/schedules, /api/mail/schedules, GET /api/scheduler/status, GET /healthz");
            shutdown.awaitRequest();
        } finally {
            try {
                for (SchedulePoller poller : started) {
                    poller.close();
                }
            } finally {
                shutdown.markStopped();
            }
        }
        return 0;
    }

    private static List<TickReport> tickAll(List<SchedulePoller> pollers) {
        List<TickReport> reports = new ArrayList<>();
        for (SchedulePoller poller : pollers) {
            reports.add(poller.tick());
        }
        return reports;
    }
}

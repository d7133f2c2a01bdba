package io.storvix.core.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.storvix.core.delivery.RecordingDeliveryAgent;
import io.storvix.core.schedule.FrequencyResolver;
import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.ScheduleService;
import io.storvix.core.schedule.ScheduleStateStore;
import io.storvix.core.schedule.store.FileScheduleRepository;
import io.storvix.core.scheduler.MailJobHandler;
import io.storvix.core.scheduler.SchedulePoller;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScheduleApiServerTest {
    private static final Instant NOW = Instant.parse("2024-06-10T08:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private RecordingDeliveryAgent delivery;
    private ScheduleStateStore store;
    private SchedulePoller mailPoller;
    private ScheduleApiServer server;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        delivery = new RecordingDeliveryAgent();
        store = new ScheduleStateStore(new FileScheduleRepository(tempDir.resolve("schedules.json")));
        ScheduleService service = new ScheduleService(store, new FrequencyResolver(), userId -> Optional.of("alice@acme.test"), delivery, clock);
        mailPoller = new SchedulePoller(
            "mail",
            List.of(new MailJobHandler((target, sections, format) -> {
                throw new UnsupportedOperationException();
            }, companies -> "<p>summary</p>", delivery)),
            store,
            new FrequencyResolver(),
            null,
            clock,
            Duration.ofSeconds(2)
        );
        server = new ScheduleApiServer(0, "127.0.0.1", service, List.of(mailPoller));
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void shouldCreateListGetAndCancelReportSchedule() throws Exception {
        HttpResponse<String> created = post("/api/reports/schedules", """
            {"userId": "u-1", "username": "alice", "company": "Acme", "host": "host-7",
             "sections": ["capacity", "health"], "format": "pdf",
             "schedulingFrequency": "custom", "customInterval": 12, "firstRunAt": "2024-06-11T00:00:00Z"}
            """);

        assertThat(created.statusCode()).isEqualTo(201);
        JsonNode job = mapper.readTree(created.body());
        String id = job.path("id").asText();
        assertThat(id).isNotBlank();
        assertThat(job.path("status").asText()).isEqualTo("scheduled");
        assertThat(job.path("frequency").asText()).isEqualTo("custom");
        assertThat(job.path("customInterval").asInt()).isEqualTo(12);
        assertThat(job.path("payload").path("type").asText()).isEqualTo("report");
        assertThat(job.path("payload").path("target").asText()).isEqualTo("host-7");
        assertThat(delivery.sent()).singleElement().satisfies(mail ->
            assertThat(mail.subject()).isEqualTo("Schedule Confirmation: Report for system host-7 - 2024-06-10"));

        JsonNode listed = mapper.readTree(get("/api/reports/schedules?userId=u-1").body());
        assertThat(listed.path("schedules").size()).isEqualTo(1);
        assertThat(mapper.readTree(get("/api/reports/schedules?company=Globex").body()).path("schedules").size()).isZero();

        assertThat(get("/api/reports/schedules/" + id).statusCode()).isEqualTo(200);
        assertThat(get("/api/mail/schedules/" + id).statusCode()).isEqualTo(404);

        HttpResponse<String> cancelled = delete("/api/reports/schedules/" + id);
        assertThat(cancelled.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(cancelled.body()).path("success").asBoolean()).isTrue();
        assertThat(store.list(JobKind.REPORT)).isEmpty();
        assertThat(delete("/api/reports/schedules/" + id).statusCode()).isEqualTo(404);
    }

    @Test
    void shouldRejectInvalidFrequencyWithoutPersisting() throws Exception {
        HttpResponse<String> response = post("/api/reports/schedules", """
            {"userId": "u-1", "host": "host-7", "format": "pdf", "schedulingFrequency": "custom", "customInterval": 0}
            """);

        assertThat(response.statusCode()).isEqualTo(400);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.path("error").asText()).isEqualTo("invalid_scheduling_parameters");
        assertThat(body.path("message").asText()).startsWith("Invalid scheduling parameters");
        assertThat(store.list(JobKind.REPORT)).isEmpty();
    }

    @Test
    void shouldAcceptFractionalCustomInterval() throws Exception {
        HttpResponse<String> created = post("/api/reports/schedules", """
            {"userId": "u-1", "host": "host-7", "format": "pdf", "schedulingFrequency": "custom", "customInterval": 1.5}
            """);

        assertThat(created.statusCode()).isEqualTo(201);
        assertThat(mapper.readTree(created.body()).path("customInterval").asDouble()).isEqualTo(1.5);
        assertThat(delivery.sent()).singleElement().satisfies(mail ->
            assertThat(mail.textBody()).contains("(every 1.5 hours)"));

        HttpResponse<String> fromText = post("/api/reports/schedules", """
            {"userId": "u-1", "host": "host-8", "format": "pdf", "schedulingFrequency": "custom", "customInterval": "24.5"}
            """);
        assertThat(fromText.statusCode()).isEqualTo(201);
        assertThat(mapper.readTree(fromText.body()).path("customInterval").asDouble()).isEqualTo(24.5);
    }

    @Test
    void shouldRejectCustomIntervalOutsideSupportedRange() throws Exception {
        HttpResponse<String> response = post("/api/reports/schedules", """
            {"userId": "u-1", "host": "host-7", "format": "pdf", "schedulingFrequency": "custom", "customInterval": 4294967301}
            """);

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(response.body()).path("message").asText()).contains("customInterval");
        assertThat(post("/api/reports/schedules", """
            {"userId": "u-1", "host": "host-7", "format": "pdf", "schedulingFrequency": "custom", "customInterval": "soon"}
            """).statusCode()).isEqualTo(400);
        assertThat(store.list(JobKind.REPORT)).isEmpty();
    }

    @Test
    void shouldIgnoreCustomIntervalForNamedFrequencies() throws Exception {
        HttpResponse<String> blank = post("/api/reports/schedules", """
            {"userId": "u-1", "host": "host-7", "format": "pdf", "schedulingFrequency": "daily", "customInterval": ""}
            """);
        HttpResponse<String> stray = post("/api/mail/schedules", """
            {"userId": "u-1", "recipients": ["ops@acme.test"], "body": "hi", "schedulingFrequency": "weekly", "customInterval": "n/a"}
            """);

        assertThat(blank.statusCode()).isEqualTo(201);
        assertThat(mapper.readTree(blank.body()).path("customInterval").isNull()).isTrue();
        assertThat(stray.statusCode()).isEqualTo(201);
        assertThat(store.list(JobKind.MAIL)).singleElement().satisfies(job ->
            assertThat(job.customInterval()).isNull());
    }

    @Test
    void shouldTreatBlankCustomIntervalAsMissingForCustomFrequency() throws Exception {
        HttpResponse<String> response = post("/api/reports/schedules", """
            {"userId": "u-1", "host": "host-7", "format": "pdf", "schedulingFrequency": "custom", "customInterval": " "}
            """);

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(response.body()).path("message").asText()).contains("positive number");
    }

    @Test
    void shouldRejectMalformedJson() throws Exception {
        HttpResponse<String> response = post("/api/mail/schedules", "{not json");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(mapper.readTree(response.body()).path("error").asText()).isEqualTo("invalid_json");
    }

    @Test
    void shouldCreateMailScheduleWithCommaSeparatedRecipients() throws Exception {
        HttpResponse<String> created = post("/api/mail/schedules", """
            {"userId": "u-1", "company": "Acme", "recipients": "ops@acme.test, cto@acme.test",
             "subject": "", "body": "<p>hello</p>", "runAlgorithm": true, "companies": ["Acme"],
             "schedulingFrequency": "weekly", "firstRunAt": 1718006400000}
            """);

        assertThat(created.statusCode()).isEqualTo(201);
        JsonNode payload = mapper.readTree(created.body()).path("payload");
        assertThat(payload.path("type").asText()).isEqualTo("mail");
        assertThat(payload.path("recipients").size()).isEqualTo(2);
        assertThat(payload.path("generateSummary").asBoolean()).isTrue();
        assertThat(mapper.readTree(created.body()).path("firstRunAt").asText()).isEqualTo("2024-06-10T08:00:00Z");
        assertThat(delivery.sent()).isEmpty();
    }

    @Test
    void shouldReportPollerStatusAfterTick() throws Exception {
        post("/api/mail/schedules", """
            {"userId": "u-1", "recipients": ["ops@acme.test"], "body": "hello", "schedulingFrequency": "once"}
            """);
        mailPoller.tick();

        JsonNode status = mapper.readTree(get("/api/scheduler/status").body());

        JsonNode poller = status.path("pollers").get(0);
        assertThat(poller.path("name").asText()).isEqualTo("mail");
        assertThat(poller.path("state").asText()).isEqualTo("idle");
        assertThat(poller.path("kinds").get(0).asText()).isEqualTo("mail");
        assertThat(poller.path("lastTick").path("due").asInt()).isEqualTo(1);
        assertThat(poller.path("lastTick").path("deleted").asInt()).isEqualTo(1);
        assertThat(store.list(JobKind.MAIL)).isEmpty();
    }

    @Test
    void shouldAnswerHealthAndRejectUnsupportedMethod() throws Exception {
        assertThat(get("/healthz").body()).contains("\"ok\"");

        HttpRequest put = HttpRequest.newBuilder(uri("/api/mail/schedules"))
            .PUT(HttpRequest.BodyPublishers.ofString("{}"))
            .build();
        assertThat(client.send(put, HttpResponse.BodyHandlers.ofString()).statusCode()).isEqualTo(405);
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> delete(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).DELETE().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String json) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }
}

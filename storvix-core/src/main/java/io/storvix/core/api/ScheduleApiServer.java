package io.storvix.core.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.storvix.core.schedule.AdvanceOutcome;
import io.storvix.core.schedule.Frequency;
import io.storvix.core.schedule.InvalidScheduleException;
import io.storvix.core.schedule.JobKind;
import io.storvix.core.schedule.JobOwner;
import io.storvix.core.schedule.JobPayload;
import io.storvix.core.schedule.MailPayload;
import io.storvix.core.schedule.ReportFormat;
import io.storvix.core.schedule.ReportPayload;
import io.storvix.core.schedule.ScheduleRequest;
import io.storvix.core.schedule.ScheduleService;
import io.storvix.core.schedule.ScheduledJob;
import io.storvix.core.scheduler.SchedulePoller;
import io.storvix.core.scheduler.TickReport;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front of the schedule store. Report and mail schedules share one handler shape and differ
 * only in how a request body becomes a payload.
 */
public final class ScheduleApiServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ScheduleApiServer.class);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final ScheduleService scheduleService;
    private final List<SchedulePoller> pollers;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public ScheduleApiServer(int port, String host, ScheduleService scheduleService, List<SchedulePoller> pollers) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.scheduleService = scheduleService;
        this.pollers = pollers == null ? List.of() : List.copyOf(pollers);
        this.running = new AtomicBoolean(false);
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/api/scheduler/status", this::handleStatus)
            .addPrefixPath("/api/reports/schedules", exchange -> handleSchedules(exchange, JobKind.REPORT))
            .addPrefixPath("/api/mail/schedules", exchange -> handleSchedules(exchange, JobKind.MAIL));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Schedule API listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleStatus(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        List<Map<String, Object>> views = new ArrayList<>();
        for (SchedulePoller poller : pollers) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("name", poller.name());
            view.put("state", poller.state().name().toLowerCase(Locale.ROOT));
            view.put("kinds", poller.kinds().stream().map(JobKind::wireName).sorted().toList());
            view.put("lastTick", poller.lastReport().map(this::toTickView).orElse(null));
            views.add(view);
        }
        sendJson(exchange, 200, Map.of("pollers", views));
    }

    private void handleSchedules(HttpServerExchange exchange, JobKind kind) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleSchedules(exchange, kind);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }

        String id = exchange.getRelativePath().replaceAll("^/+|/+$", "");
        String method = exchange.getRequestMethod().toString();
        if (id.isEmpty()) {
            if ("GET".equalsIgnoreCase(method)) {
                List<Map<String, Object>> schedules = scheduleService.list(kind, queryParam(exchange, "userId"), queryParam(exchange, "company"))
                    .stream()
                    .map(this::toJobView)
                    .toList();
                sendJson(exchange, 200, Map.of("schedules", schedules));
                return;
            }
            if ("POST".equalsIgnoreCase(method)) {
                createSchedule(exchange, kind);
                return;
            }
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }

        Optional<ScheduledJob> existing = scheduleService.get(id).filter(job -> job.kind() == kind);
        if ("GET".equalsIgnoreCase(method)) {
            if (existing.isEmpty()) {
                sendJson(exchange, 404, Map.of("error", "not_found"));
                return;
            }
            sendJson(exchange, 200, toJobView(existing.get()));
            return;
        }
        if ("DELETE".equalsIgnoreCase(method)) {
            if (existing.isEmpty() || scheduleService.cancel(id).isEmpty()) {
                sendJson(exchange, 404, Map.of("error", "not_found"));
                return;
            }
            sendJson(exchange, 200, Map.of("success", true, "id", id));
            return;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
    }

    private void createSchedule(HttpServerExchange exchange, JobKind kind) throws IOException {
        JsonNode body;
        try {
            body = readJsonBody(exchange);
        } catch (IOException e) {
            sendJson(exchange, 400, Map.of("error", "invalid_json"));
            return;
        }
        try {
            JobOwner owner = new JobOwner(
                readString(body, "userId", ""),
                readString(body, "username", ""),
                readString(body, "company", "")
            );
            JobPayload payload = kind == JobKind.REPORT ? reportPayload(body) : mailPayload(body);
            String frequency = readString(body, "schedulingFrequency", readString(body, "frequency", ""));
            ScheduleRequest request = new ScheduleRequest(
                owner,
                payload,
                frequency,
                Frequency.parse(frequency).filter(Frequency.CUSTOM::equals).isPresent() ? readNumber(body, "customInterval") : null,
                readInstant(body, "firstRunAt")
            );
            ScheduledJob job = scheduleService.schedule(request);
            sendJson(exchange, 201, toJobView(job));
        } catch (InvalidScheduleException e) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", "invalid_scheduling_parameters");
            error.put("message", e.getMessage());
            sendJson(exchange, 400, error);
        }
    }

    private ReportPayload reportPayload(JsonNode body) {
        return new ReportPayload(
            readString(body, "host", readString(body, "target", "")),
            readStringList(body, "sections", List.of()),
            readFormat(body, true)
        );
    }

    private MailPayload mailPayload(JsonNode body) {
        boolean attachReport = readBoolean(body, "attachReport", false);
        return new MailPayload(
            readStringList(body, "recipients", List.of()),
            readString(body, "subject", ""),
            readString(body, "body", ""),
            attachReport,
            readString(body, "host", readString(body, "target", "")),
            readStringList(body, "sections", List.of()),
            readFormat(body, attachReport),
            readBoolean(body, "runAlgorithm", readBoolean(body, "generateSummary", false)),
            readStringList(body, "companies", List.of())
        );
    }

    private ReportFormat readFormat(JsonNode body, boolean required) {
        String raw = readString(body, "format", "");
        if (raw.isEmpty() && !required) {
            return null;
        }
        return ReportFormat.parse(raw)
            .orElseThrow(() -> new InvalidScheduleException("Invalid scheduling parameters: format must be one of pdf, xlsx"));
    }

    private Instant readInstant(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return Instant.ofEpochMilli(node.longValue());
        }
        String raw = node.asText("").trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new InvalidScheduleException("Invalid scheduling parameters: " + field + " must be an ISO-8601 instant");
        }
    }

    private Map<String, Object> toJobView(ScheduledJob job) {
        Map<String, Object> view = new LinkedHashMap<>(mapper.convertValue(job, JSON_OBJECT));
        view.put("status", job.nextRunAt() == null ? "completed" : "scheduled");
        return view;
    }

    private Map<String, Object> toTickView(TickReport report) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("at", report.now().toString());
        view.put("due", report.due());
        view.put("delivered", report.delivered());
        view.put("failed", report.failed());
        view.put("advanced", report.count(AdvanceOutcome.ADVANCED));
        view.put("completed", report.count(AdvanceOutcome.COMPLETED));
        view.put("deleted", report.count(AdvanceOutcome.DELETED));
        view.put("retryPending", report.retryPending());
        view.put("expiredSubscriptions", report.expiredSubscriptions());
        view.put("unreadableKinds", report.unreadableKinds().stream().map(JobKind::wireName).toList());
        return view;
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        JsonNode node = mapper.readTree(bytes);
        return node == null || !node.isObject() ? mapper.createObjectNode() : node;
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return "";
        }
        String value = values.getFirst();
        return value == null ? "" : value.trim();
    }

    private String readString(JsonNode body, String field, String fallback) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        String value = node.asText();
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private Double readNumber(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        String raw = node.asText("").trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(raw).doubleValue();
        } catch (NumberFormatException e) {
            throw new InvalidScheduleException("Invalid scheduling parameters: " + field + " must be a number");
        }
    }

    private boolean readBoolean(JsonNode body, String field, boolean fallback) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return "true".equalsIgnoreCase(node.asText("").trim());
    }

    private List<String> readStringList(JsonNode body, String field, List<String> fallback) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode item : node) {
                String value = item.asText("");
                if (!value.isBlank()) {
                    values.add(value.trim());
                }
            }
            return values;
        }
        String raw = node.asText("");
        if (raw.isBlank()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (String value : raw.split(",")) {
            String trimmed = value.trim();
            if (!trimmed.isBlank()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, Map.of("error", error.getMessage() == null ? "internal_error" : error.getMessage()));
        } catch (IOException e) {
            LOG.debug("Could not send error response: {}", e.getMessage());
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port: {}", e.getMessage());
        }
        return fallbackPort;
    }
}

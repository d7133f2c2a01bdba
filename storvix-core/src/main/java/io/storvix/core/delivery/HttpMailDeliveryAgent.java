package io.storvix.core.delivery;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.storvix.core.artifact.Artifact;
import io.storvix.core.config.model.MailConfig;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Dispatcher;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers mail through a JSON mail-relay API ({@code POST {apiBase}/messages}).
 * Calls are asynchronous; the client's dispatcher bounds how many run at once and its call
 * timeout bounds how long any single send may take.
 */
public final class HttpMailDeliveryAgent implements DeliveryAgent {
    private static final Logger LOG = LoggerFactory.getLogger(HttpMailDeliveryAgent.class);
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String apiBase;
    private final String apiKey;
    private final String from;

    public HttpMailDeliveryAgent(OkHttpClient client, ObjectMapper mapper, String apiBase, String apiKey, String from) {
        if (apiBase == null || apiBase.isBlank()) {
            throw new IllegalArgumentException("apiBase must not be blank");
        }
        this.client = client;
        this.mapper = mapper;
        this.apiBase = apiBase.replaceAll("/+$", "");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.from = from == null ? "" : from;
    }

    public static HttpMailDeliveryAgent fromConfig(MailConfig config, ObjectMapper mapper) {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(config.maxConcurrentDeliveries());
        dispatcher.setMaxRequestsPerHost(config.maxConcurrentDeliveries());
        OkHttpClient client = new OkHttpClient.Builder()
            .dispatcher(dispatcher)
            .callTimeout(Duration.ofSeconds(config.sendTimeoutSeconds()))
            .build();
        return new HttpMailDeliveryAgent(client, mapper, config.apiBase(), config.apiKey(), config.from());
    }

    @Override
    public CompletableFuture<DeliveryResult> send(MailMessage message) {
        if (message.to().isEmpty()) {
            return CompletableFuture.completedFuture(DeliveryResult.failed("no recipients"));
        }
        Request request;
        try {
            request = new Request.Builder()
                .url(apiBase + "/messages")
                .addHeader("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(mapper.writeValueAsString(payload(message)), JSON))
                .build();
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Could not build mail request '{}': {}", message.subject(), e.getMessage());
            return CompletableFuture.completedFuture(DeliveryResult.failed(e.getMessage()));
        }

        CompletableFuture<DeliveryResult> result = new CompletableFuture<>();
        Call call = client.newCall(request);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                LOG.warn("Mail '{}' to {} failed: {}", message.subject(), message.to(), e.getMessage());
                result.complete(DeliveryResult.failed(e.getMessage()));
            }

            @Override
            public void onResponse(Call completed, Response response) {
                try (response) {
                    if (response.isSuccessful()) {
                        LOG.info("Mail '{}' sent to {}", message.subject(), message.to());
                        result.complete(DeliveryResult.delivered("http " + response.code()));
                    } else {
                        String body = response.body() == null ? "" : response.body().string();
                        LOG.warn("Mail relay rejected '{}' with http {}: {}", message.subject(), response.code(), body);
                        result.complete(DeliveryResult.failed("http " + response.code()));
                    }
                } catch (IOException e) {
                    result.complete(DeliveryResult.failed(e.getMessage()));
                }
            }
        });
        // a caller giving up on the future also gives up on the request
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                call.cancel();
            }
        });
        return result;
    }

    private Map<String, Object> payload(MailMessage message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("from", from);
        body.put("to", message.to());
        body.put("subject", message.subject());
        body.put("text", message.textBody());
        if (message.htmlBody() != null && !message.htmlBody().isBlank()) {
            body.put("html", message.htmlBody());
        }
        List<Map<String, Object>> attachments = new ArrayList<>();
        message.attachmentIfAny().ifPresent(artifact -> attachments.add(attachment(artifact)));
        body.put("attachments", attachments);
        return body;
    }

    private Map<String, Object> attachment(Artifact artifact) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("filename", artifact.filename());
        entry.put("content_type", artifact.mimeType());
        entry.put("content", Base64.getEncoder().encodeToString(artifact.content()));
        return entry;
    }
}

package io.storvix.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MailConfig(
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"api_key"}) String apiKey,
    String from,
    @JsonAlias({"send_timeout_seconds"}) int sendTimeoutSeconds,
    @JsonAlias({"max_concurrent_deliveries"}) int maxConcurrentDeliveries
) {
    public static final String API_KEY_ENV = "STORVIX_MAIL_API_KEY";
    public static final String FROM_ENV = "STORVIX_MAIL_FROM";

    public MailConfig {
        apiBase = apiBase == null ? "" : apiBase.trim();
        apiKey = apiKey == null ? "" : apiKey.trim();
        from = from == null ? "" : from.trim();
        if (sendTimeoutSeconds <= 0) {
            sendTimeoutSeconds = 30;
        }
        if (maxConcurrentDeliveries <= 0) {
            maxConcurrentDeliveries = 4;
        }
    }

    public static MailConfig defaults() {
        return new MailConfig("", "", "no-reply@storvix.eu", 30, 4);
    }

    public boolean configured() {
        return !apiBase.isBlank() && !apiKey.isBlank();
    }

    public MailConfig withEnvironment(Map<String, String> env) {
        if (env == null) {
            return this;
        }
        return new MailConfig(
            apiBase,
            envOr(env, API_KEY_ENV, apiKey),
            envOr(env, FROM_ENV, from),
            sendTimeoutSeconds,
            maxConcurrentDeliveries
        );
    }

    private static String envOr(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value;
    }
}

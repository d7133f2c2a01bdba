package io.storvix.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiConfig(
    String host,
    int port
) {
    public ApiConfig {
        host = host == null || host.isBlank() ? "0.0.0.0" : host.trim();
    }

    public static ApiConfig defaults() {
        return new ApiConfig("0.0.0.0", 8790);
    }
}

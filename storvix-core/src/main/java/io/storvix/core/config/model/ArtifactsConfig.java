package io.storvix.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtifactsConfig(
    @JsonAlias({"production_timeout_seconds"}) int productionTimeoutSeconds
) {
    public ArtifactsConfig {
        if (productionTimeoutSeconds <= 0) {
            productionTimeoutSeconds = 60;
        }
    }

    public static ArtifactsConfig defaults() {
        return new ArtifactsConfig(60);
    }
}

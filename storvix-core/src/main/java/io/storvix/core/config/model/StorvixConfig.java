package io.storvix.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorvixConfig(
    SchedulerConfig scheduler,
    StorageConfig storage,
    MailConfig mail,
    ArtifactsConfig artifacts,
    ApiConfig api
) {

    public static StorvixConfig defaults() {
        return new StorvixConfig(
            SchedulerConfig.defaults(),
            StorageConfig.defaults(),
            MailConfig.defaults(),
            ArtifactsConfig.defaults(),
            ApiConfig.defaults()
        );
    }

    public StorvixConfig withEnvironment(Map<String, String> env) {
        return new StorvixConfig(scheduler, storage, mail.withEnvironment(env), artifacts, api);
    }
}

package io.storvix.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    @JsonAlias({"report_poll_seconds"}) int reportPollSeconds,
    @JsonAlias({"mail_poll_seconds"}) int mailPollSeconds,
    @JsonAlias({"initial_delay_seconds"}) int initialDelaySeconds
) {
    public SchedulerConfig {
        if (reportPollSeconds <= 0) {
            throw new IllegalArgumentException("scheduler.reportPollSeconds must be > 0");
        }
        if (mailPollSeconds <= 0) {
            throw new IllegalArgumentException("scheduler.mailPollSeconds must be > 0");
        }
        if (initialDelaySeconds < 0) {
            throw new IllegalArgumentException("scheduler.initialDelaySeconds must be >= 0");
        }
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(2400, 60, 5);
    }
}

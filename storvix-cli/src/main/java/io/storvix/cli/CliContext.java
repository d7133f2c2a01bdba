package io.storvix.cli;

import io.storvix.core.config.ConfigService;
import io.storvix.core.schedule.ScheduleService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    ScheduleService scheduleService,
    TickRunner tickRunner,
    SchedulerRunner schedulerRunner
) {
    public CliContext(ConfigService configService, Path configPath, ScheduleService scheduleService) {
        this(
            configService,
            configPath,
            scheduleService,
            () -> {
                throw new UnsupportedOperationException("tick runner is not configured");
            },
            port -> {
                throw new UnsupportedOperationException("scheduler runner is not configured");
            }
        );
    }
}

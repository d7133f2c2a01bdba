package io.storvix.core.fleet;

import java.time.Duration;
import java.time.Instant;

/**
 * Severity bucket of a system, from used capacity and telemetry freshness.
 */
public enum HealthBucket {
    CRITICAL("Critical", "#d32f2f"),
    ALERT("Alert", "#f57c00"),
    ATTENTION("Attention", "#fbc02d"),
    NO_TELEMETRY("No telemetry", "#616161"),
    OK("OK", "#388e3c");

    private static final Duration STALE_AFTER = Duration.ofHours(24);

    private final String label;
    private final String color;

    HealthBucket(String label, String color) {
        this.label = label;
        this.color = color;
    }

    public String label() {
        return label;
    }

    public String color() {
        return color;
    }

    public static HealthBucket classify(StorageSystem system, Instant now) {
        boolean stale = !system.sendingTelemetry()
            || system.lastSeenAt() == null
            || Duration.between(system.lastSeenAt(), now).compareTo(STALE_AFTER) > 0;
        if (stale) {
            return NO_TELEMETRY;
        }
        double used = system.usedPercent();
        if (used > 90) {
            return CRITICAL;
        }
        if (used > 80) {
            return ALERT;
        }
        if (used > 70) {
            return ATTENTION;
        }
        return OK;
    }
}

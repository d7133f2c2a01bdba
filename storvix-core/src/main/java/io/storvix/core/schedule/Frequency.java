package io.storvix.core.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

public enum Frequency {
    ONCE,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY,
    CUSTOM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Frequency fromWire(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown frequency: " + raw));
    }

    public static Optional<Frequency> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Frequency frequency : values()) {
            if (frequency.name().equals(normalized)) {
                return Optional.of(frequency);
            }
        }
        return Optional.empty();
    }
}

package io.storvix.core.schedule;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

public enum JobKind {
    /** Completed report jobs stay in the store with no next run so they remain visible as history. */
    REPORT(true),
    /** Completed mail jobs are removed from the store. */
    MAIL(false);

    private final boolean retainsCompletedJobs;

    JobKind(boolean retainsCompletedJobs) {
        this.retainsCompletedJobs = retainsCompletedJobs;
    }

    public boolean retainsCompletedJobs() {
        return retainsCompletedJobs;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<JobKind> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (JobKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}

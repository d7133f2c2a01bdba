package io.storvix.core.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the next due time of a recurring job from a reference time.
 * An empty result means "no further occurrence": one-shot jobs, unknown frequencies and
 * custom jobs without a usable interval all resolve to empty.
 */
public final class FrequencyResolver {
    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration DAY = Duration.ofHours(24);
    private static final Duration WEEK = Duration.ofDays(7);
    // fixed 30 days, not calendar months
    private static final Duration MONTH = Duration.ofDays(30);

    public Optional<Instant> resolve(Instant reference, Frequency frequency, Double customInterval) {
        Objects.requireNonNull(reference, "reference must not be null");
        if (frequency == null) {
            return Optional.empty();
        }
        return switch (frequency) {
            case HOURLY -> Optional.of(reference.plus(HOUR));
            case DAILY -> Optional.of(reference.plus(DAY));
            case WEEKLY -> Optional.of(reference.plus(WEEK));
            case MONTHLY -> Optional.of(reference.plus(MONTH));
            case CUSTOM -> CustomInterval.toDuration(customInterval).map(reference::plus);
            case ONCE -> Optional.empty();
        };
    }

    public Optional<Instant> resolve(Instant reference, String frequency, Double customInterval) {
        Objects.requireNonNull(reference, "reference must not be null");
        return Frequency.parse(frequency).flatMap(parsed -> resolve(reference, parsed, customInterval));
    }
}

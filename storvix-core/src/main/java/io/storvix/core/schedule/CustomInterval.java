package io.storvix.core.schedule;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * Unit rule for {@code customInterval}: the unit is picked from the magnitude of the value.
 * Values up to and including {@link #HOURS_THRESHOLD} count hours, larger values count days,
 * so {@code 24} means one day expressed in hours and {@code 25} means twenty-five days.
 * Fractions are allowed: {@code 1.5} is ninety minutes and {@code 24.5} is twenty-four and a half days.
 * Values above {@link #MAX_VALUE} days are rejected.
 */
public final class CustomInterval {
    public static final int HOURS_THRESHOLD = 24;
    public static final int MAX_VALUE = 36_500;

    private static final long MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();
    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private CustomInterval() {
    }

    public static boolean isValid(Double value) {
        return value != null && !value.isNaN() && !value.isInfinite() && value > 0 && value <= MAX_VALUE;
    }

    public static Optional<Duration> toDuration(Double value) {
        if (!isValid(value)) {
            return Optional.empty();
        }
        long unit = inHours(value) ? MILLIS_PER_HOUR : MILLIS_PER_DAY;
        long millis = Math.round(value * unit);
        return millis <= 0 ? Optional.empty() : Optional.of(Duration.ofMillis(millis));
    }

    public static boolean inHours(double value) {
        return value <= HOURS_THRESHOLD;
    }

    public static String format(Double value) {
        if (value == null) {
            return "";
        }
        if (value.isNaN() || value.isInfinite()) {
            return value.toString();
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String describe(Double value) {
        return "every " + format(value) + " " + (value != null && inHours(value) ? "hours" : "days");
    }
}

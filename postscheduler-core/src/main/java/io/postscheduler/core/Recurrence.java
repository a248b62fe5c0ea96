package io.postscheduler.core;

import io.postscheduler.exception.RecurrenceConfigException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Recurrence policy of a scheduled post.
 *
 * <p>Periods are fixed durations on naive local timestamps: a month is always 30 days and no
 * DST or calendar adjustment is applied.
 */
public enum Recurrence {
    NONE(null),
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7)),
    MONTHLY(Duration.ofDays(30));

    private final Duration period;

    Recurrence(Duration period) {
        this.period = period;
    }

    /**
     * Fixed period between occurrences, or null for {@link #NONE}.
     */
    public Duration period() {
        return period;
    }

    public boolean isRecurring() {
        return period != null;
    }

    /**
     * Next occurrence after {@code base}, or null when the policy does not repeat.
     */
    public LocalDateTime nextOccurrence(LocalDateTime base) {
        if (period == null) {
            return null;
        }
        if (base == null) {
            throw new IllegalArgumentException("base must not be null for recurring policy " + value());
        }
        return base.plus(period);
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a wire value ("none", "daily", "weekly", "monthly"), case-insensitive.
     * Null or blank means {@link #NONE}.
     *
     * @throws RecurrenceConfigException for any other value
     */
    public static Recurrence fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Recurrence r : values()) {
            if (r.value().equals(v)) {
                return r;
            }
        }
        throw new RecurrenceConfigException(value);
    }
}

package reminders.dispatcher.model;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Recurrence policy of a reminder task.
 */
public enum Cadence {
    /** Send exactly once, ever */
    NONE,
    /** Every 24 hours */
    DAILY,
    /** Every 7 days */
    WEEKLY,
    /** Every calendar month */
    MONTHLY;

    public boolean isRecurring() {
        return this != NONE;
    }

    /**
     * Earliest instant at which a recurring task notified at {@code lastNotifiedAt}
     * may be notified again. Monthly periods are calendar months in {@code zone}.
     *
     * @throws IllegalStateException for {@link #NONE}, which has no period
     */
    public Instant nextEligibleAfter(Instant lastNotifiedAt, ZoneId zone) {
        return switch (this) {
            case DAILY -> lastNotifiedAt.plus(Duration.ofDays(1));
            case WEEKLY -> lastNotifiedAt.plus(Duration.ofDays(7));
            case MONTHLY -> lastNotifiedAt.atZone(zone).plusMonths(1).toInstant();
            case NONE -> throw new IllegalStateException("NONE cadence has no period");
        };
    }

    /**
     * Parse a cadence name, case-insensitive. Null or blank means {@link #NONE}.
     */
    public static Cadence parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return Cadence.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown cadence: " + value);
        }
    }
}

package reminders.dispatcher.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * When a {@link Ticker} fires next.
 */
public interface TickSchedule {

    /**
     * Delay from {@code now} until the next firing. Always positive.
     */
    Duration delayUntilNext(Instant now);

    static TickSchedule every(Duration interval) {
        return new FixedInterval(interval);
    }

    static TickSchedule dailyAt(LocalTime timeOfDay, ZoneId zone) {
        return new DailyAt(timeOfDay, zone);
    }

    record FixedInterval(Duration interval) implements TickSchedule {
        public FixedInterval {
            Objects.requireNonNull(interval, "interval is required");
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("interval must be positive");
            }
        }

        @Override
        public Duration delayUntilNext(Instant now) {
            return interval;
        }
    }

    record DailyAt(LocalTime timeOfDay, ZoneId zone) implements TickSchedule {
        public DailyAt {
            Objects.requireNonNull(timeOfDay, "timeOfDay is required");
            Objects.requireNonNull(zone, "zone is required");
        }

        @Override
        public Duration delayUntilNext(Instant now) {
            ZonedDateTime local = now.atZone(zone);
            ZonedDateTime next = local.toLocalDate().atTime(timeOfDay).atZone(zone);
            if (!next.isAfter(local)) {
                next = local.toLocalDate().plusDays(1).atTime(timeOfDay).atZone(zone);
            }
            return Duration.between(now, next.toInstant());
        }
    }
}

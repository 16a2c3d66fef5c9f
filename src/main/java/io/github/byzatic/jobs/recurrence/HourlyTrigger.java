package io.github.byzatic.jobs.recurrence;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires every hour at a fixed minute.
 */
public final class HourlyTrigger implements TriggerDescriptor {
    private final int minute;

    HourlyTrigger(int minute) {
        if (minute < 0 || minute > 59) throw new IllegalArgumentException("minute out of range: " + minute);
        this.minute = minute;
    }

    public int getMinute() {
        return minute;
    }

    @Override
    public @NotNull Optional<Instant> next(@NotNull Instant reference, @NotNull ZoneId zone) {
        ZonedDateTime candidate = ZonedDateTime.ofInstant(reference, zone)
                .withMinute(minute)
                .withSecond(0)
                .withNano(0);
        if (!candidate.toInstant().isAfter(reference)) {
            // instant time-line, so an hour is always 60 minutes here
            candidate = candidate.plusHours(1);
        }
        return Optional.of(candidate.toInstant());
    }

    @Override
    public @NotNull RecurrenceType type() {
        return RecurrenceType.HOURLY;
    }

    @Override
    public @NotNull String describe() {
        return "hourly at minute " + minute;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return minute == ((HourlyTrigger) o).minute;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minute);
    }

    @Override
    public String toString() {
        return "HourlyTrigger{minute=" + minute + '}';
    }
}

package io.github.byzatic.jobs.recurrence;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires once a day at a wall-clock time.
 */
public final class DailyTrigger implements TriggerDescriptor {
    private final LocalTime time;

    DailyTrigger(@NotNull LocalTime time) {
        this.time = Objects.requireNonNull(time).withSecond(0).withNano(0);
    }

    public @NotNull LocalTime getTime() {
        return time;
    }

    @Override
    public @NotNull Optional<Instant> next(@NotNull Instant reference, @NotNull ZoneId zone) {
        LocalDate day = ZonedDateTime.ofInstant(reference, zone).toLocalDate();
        ZonedDateTime candidate = ZonedDateTime.of(day, time, zone);
        if (!candidate.toInstant().isAfter(reference)) {
            candidate = ZonedDateTime.of(day.plusDays(1), time, zone);
        }
        return Optional.of(candidate.toInstant());
    }

    @Override
    public @NotNull RecurrenceType type() {
        return RecurrenceType.DAILY;
    }

    @Override
    public @NotNull String describe() {
        return "daily " + time;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return time.equals(((DailyTrigger) o).time);
    }

    @Override
    public int hashCode() {
        return Objects.hash(time);
    }

    @Override
    public String toString() {
        return "DailyTrigger{time=" + time + '}';
    }
}

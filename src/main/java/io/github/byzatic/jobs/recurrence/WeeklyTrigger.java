package io.github.byzatic.jobs.recurrence;

import org.jetbrains.annotations.NotNull;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires once a week on a given day at a wall-clock time.
 */
public final class WeeklyTrigger implements TriggerDescriptor {
    private final DayOfWeek dayOfWeek;
    private final LocalTime time;

    WeeklyTrigger(@NotNull DayOfWeek dayOfWeek, @NotNull LocalTime time) {
        this.dayOfWeek = Objects.requireNonNull(dayOfWeek);
        this.time = Objects.requireNonNull(time).withSecond(0).withNano(0);
    }

    public @NotNull DayOfWeek getDayOfWeek() {
        return dayOfWeek;
    }

    public @NotNull LocalTime getTime() {
        return time;
    }

    @Override
    public @NotNull Optional<Instant> next(@NotNull Instant reference, @NotNull ZoneId zone) {
        LocalDate day = ZonedDateTime.ofInstant(reference, zone)
                .toLocalDate()
                .with(TemporalAdjusters.nextOrSame(dayOfWeek));
        ZonedDateTime candidate = ZonedDateTime.of(day, time, zone);
        if (!candidate.toInstant().isAfter(reference)) {
            // same weekday but the time has already passed
            candidate = ZonedDateTime.of(day.plusWeeks(1), time, zone);
        }
        return Optional.of(candidate.toInstant());
    }

    @Override
    public @NotNull RecurrenceType type() {
        return RecurrenceType.WEEKLY;
    }

    @Override
    public @NotNull String describe() {
        return "weekly " + dayOfWeek + " " + time;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WeeklyTrigger that = (WeeklyTrigger) o;
        return dayOfWeek == that.dayOfWeek && time.equals(that.time);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dayOfWeek, time);
    }

    @Override
    public String toString() {
        return "WeeklyTrigger{dayOfWeek=" + dayOfWeek + ", time=" + time + '}';
    }
}

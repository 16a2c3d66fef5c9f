package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.recurrence.RecurrenceType;
import io.github.byzatic.jobs.recurrence.TriggerDescriptor;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sub-minute trigger so dispatcher tests run in milliseconds. Can be told to stop producing fire times.
 */
final class IntervalTrigger implements TriggerDescriptor {
    private final Duration first;
    private final Duration interval;
    private final AtomicInteger remaining;
    private final AtomicInteger calls = new AtomicInteger();

    IntervalTrigger(Duration interval) {
        this(interval, interval, Integer.MAX_VALUE);
    }

    IntervalTrigger(Duration interval, int fireTimes) {
        this(interval, interval, fireTimes);
    }

    IntervalTrigger(Duration first, Duration interval, int fireTimes) {
        this.first = first;
        this.interval = interval;
        this.remaining = new AtomicInteger(fireTimes);
    }

    @Override
    public @NotNull Optional<Instant> next(@NotNull Instant reference, @NotNull ZoneId zone) {
        if (remaining.getAndDecrement() <= 0) return Optional.empty();
        return Optional.of(reference.plus(calls.getAndIncrement() == 0 ? first : interval));
    }

    @Override
    public @NotNull RecurrenceType type() {
        return RecurrenceType.HOURLY;
    }

    @Override
    public @NotNull String describe() {
        return "every " + interval.toMillis() + " ms";
    }
}

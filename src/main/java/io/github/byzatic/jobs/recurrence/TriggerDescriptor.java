package io.github.byzatic.jobs.recurrence;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Resolved recurrence rule able to produce fire times.
 */
public interface TriggerDescriptor {

    /**
     * Earliest instant strictly after {@code reference} that matches the rule, evaluated on the
     * wall clock of {@code zone}. Empty when no such instant exists.
     */
    @NotNull
    Optional<Instant> next(@NotNull Instant reference, @NotNull ZoneId zone);

    @NotNull
    RecurrenceType type();

    /**
     * Canonical text of the rule, e.g. {@code "weekly SUNDAY 08:00"}.
     */
    @NotNull
    String describe();
}

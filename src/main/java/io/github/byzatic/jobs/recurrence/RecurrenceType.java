package io.github.byzatic.jobs.recurrence;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported recurrence kinds. The wire value is the lower-case name.
 */
public enum RecurrenceType {
    HOURLY, DAILY, WEEKLY;

    public @NotNull String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup; surrounding whitespace is ignored.
     */
    public static Optional<RecurrenceType> lookup(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (RecurrenceType t : values()) {
            if (t.name().equals(v)) return Optional.of(t);
        }
        return Optional.empty();
    }
}

package io.github.byzatic.jobs.recurrence;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import io.github.byzatic.jobs.base_exceptions.InvalidRuleException;
import org.jetbrains.annotations.NotNull;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a job's {@code type} + {@code time} pair into a {@link TriggerDescriptor}.
 * <ul>
 *   <li>{@code hourly}: minute of hour, {@code "0".."59"}</li>
 *   <li>{@code daily}: {@code "HH:MM"}, 24-hour</li>
 *   <li>{@code weekly}: {@code "<day> HH:MM"}, day name case-insensitive, full or three-letter</li>
 * </ul>
 */
public final class RecurrenceRule {
    private static final Pattern HOUR_MINUTE = Pattern.compile("(\\d{1,2}):(\\d{1,2})");
    private static final Splitter WHITESPACE = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private static final Map<String, DayOfWeek> DAY_NAMES;

    static {
        ImmutableMap.Builder<String, DayOfWeek> b = ImmutableMap.builder();
        for (DayOfWeek d : DayOfWeek.values()) {
            String full = d.name().toLowerCase(Locale.ROOT);
            b.put(full, d);
            b.put(full.substring(0, 3), d);
        }
        DAY_NAMES = b.build();
    }

    private RecurrenceRule() {
    }

    public static @NotNull TriggerDescriptor resolve(String recurrenceType, String timeSpec) throws InvalidRuleException {
        RecurrenceType type = RecurrenceType.lookup(recurrenceType)
                .orElseThrow(() -> new InvalidRuleException(recurrenceType, timeSpec, "Unknown recurrence type"));
        if (timeSpec == null || timeSpec.isBlank()) {
            throw new InvalidRuleException(recurrenceType, timeSpec, "Time spec is empty");
        }
        switch (type) {
            case HOURLY:
                return new HourlyTrigger(parseMinuteOfHour(recurrenceType, timeSpec));
            case DAILY:
                return new DailyTrigger(parseHourMinute(recurrenceType, timeSpec, timeSpec.trim()));
            case WEEKLY:
                return parseWeekly(recurrenceType, timeSpec);
            default:
                throw new InvalidRuleException(recurrenceType, timeSpec, "Unsupported recurrence type");
        }
    }

    private static int parseMinuteOfHour(String type, String spec) throws InvalidRuleException {
        Integer minute = Ints.tryParse(spec.trim());
        if (minute == null) {
            throw new InvalidRuleException(type, spec, "Minute of hour is not a number");
        }
        if (minute < 0 || minute > 59) {
            throw new InvalidRuleException(type, spec, "Minute of hour must be within 0..59");
        }
        return minute;
    }

    private static LocalTime parseHourMinute(String type, String spec, String value) throws InvalidRuleException {
        Matcher m = HOUR_MINUTE.matcher(value);
        if (!m.matches()) {
            throw new InvalidRuleException(type, spec, "Expected HH:MM");
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        if (hour > 23 || minute > 59) {
            throw new InvalidRuleException(type, spec, "Hour must be within 0..23 and minute within 0..59");
        }
        return LocalTime.of(hour, minute);
    }

    private static WeeklyTrigger parseWeekly(String type, String spec) throws InvalidRuleException {
        List<String> parts = WHITESPACE.splitToList(spec);
        if (parts.size() != 2) {
            throw new InvalidRuleException(type, spec, "Expected '<day> HH:MM'");
        }
        DayOfWeek day = DAY_NAMES.get(parts.get(0).toLowerCase(Locale.ROOT));
        if (day == null) {
            throw new InvalidRuleException(type, spec, "Unknown day name '" + parts.get(0) + "'");
        }
        return new WeeklyTrigger(day, parseHourMinute(type, spec, parts.get(1)));
    }
}

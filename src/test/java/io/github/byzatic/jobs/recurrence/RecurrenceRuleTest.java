package io.github.byzatic.jobs.recurrence;

import io.github.byzatic.jobs.base_exceptions.InvalidRuleException;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RecurrenceRuleTest {
    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    void resolvesHourlyMinute() throws Exception {
        TriggerDescriptor d = RecurrenceRule.resolve("hourly", "15");
        assertEquals(RecurrenceType.HOURLY, d.type());
        assertEquals(15, ((HourlyTrigger) d).getMinute());
    }

    @Test
    void resolvesDailyAndWeekly_caseInsensitive() throws Exception {
        TriggerDescriptor daily = RecurrenceRule.resolve("DAILY", "14:30");
        assertEquals(LocalTime.of(14, 30), ((DailyTrigger) daily).getTime());

        WeeklyTrigger weekly = (WeeklyTrigger) RecurrenceRule.resolve("Weekly", "sUnDaY 08:00");
        assertEquals(DayOfWeek.SUNDAY, weekly.getDayOfWeek());
        assertEquals(LocalTime.of(8, 0), weekly.getTime());

        WeeklyTrigger shortName = (WeeklyTrigger) RecurrenceRule.resolve("weekly", "mon 12:45");
        assertEquals(DayOfWeek.MONDAY, shortName.getDayOfWeek());
    }

    @Test
    void rejectsMalformedRules() {
        assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve("bogus", "x"));
        assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve(null, "10"));
        assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve("hourly", "60"));
        assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve("hourly", "-1"));
        assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve("hourly", "abc"));
        assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve("daily", "24:00"));
        assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve("daily", "12:60"));
        assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve("daily", "1230"));
        assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve("daily", ""));
        assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve("weekly", "08:00"));
        assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve("weekly", "funday 08:00"));
        assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve("weekly", "monday 8"));
    }

    @Test
    void invalidRuleCarriesInput() {
        InvalidRuleException e = assertThrows(InvalidRuleException.class, () -> RecurrenceRule.resolve("bogus", "x"));
        assertEquals("bogus", e.getRecurrenceType());
        assertEquals("x", e.getTimeSpec());
    }

    @Test
    void dailyScenario_backupAt0230() throws Exception {
        TriggerDescriptor d = RecurrenceRule.resolve("daily", "02:30");
        Instant next = d.next(Instant.parse("2024-01-01T10:00:00Z"), UTC).orElseThrow();
        assertEquals(Instant.parse("2024-01-02T02:30:00Z"), next);
    }

    @Test
    void weeklyScenario_sameDayAfterTime_goesToFollowingWeek() throws Exception {
        TriggerDescriptor d = RecurrenceRule.resolve("weekly", "Sunday 08:00");
        // 2024-01-07 is a Sunday
        Instant next = d.next(Instant.parse("2024-01-07T09:00:00Z"), UTC).orElseThrow();
        assertEquals(Instant.parse("2024-01-14T08:00:00Z"), next);
    }

    @Test
    void weeklyScenario_sameDayBeforeTime_firesToday() throws Exception {
        TriggerDescriptor d = RecurrenceRule.resolve("weekly", "sun 08:00");
        Instant next = d.next(Instant.parse("2024-01-07T07:59:00Z"), UTC).orElseThrow();
        assertEquals(Instant.parse("2024-01-07T08:00:00Z"), next);
    }

    @Test
    void nextIsStrictlyAfterReference_whenReferenceMatchesExactly() throws Exception {
        Instant exact = Instant.parse("2024-03-05T11:15:00Z");
        assertEquals(Instant.parse("2024-03-05T12:15:00Z"),
                RecurrenceRule.resolve("hourly", "15").next(exact, UTC).orElseThrow());
        assertEquals(Instant.parse("2024-03-06T11:15:00Z"),
                RecurrenceRule.resolve("daily", "11:15").next(exact, UTC).orElseThrow());
        // 2024-03-05 is a Tuesday
        assertEquals(Instant.parse("2024-03-12T11:15:00Z"),
                RecurrenceRule.resolve("weekly", "tuesday 11:15").next(exact, UTC).orElseThrow());
    }

    @Test
    void hourlyNextAlwaysWithinOneHour() throws Exception {
        Random random = new Random(42);
        for (int minute = 0; minute < 60; minute++) {
            TriggerDescriptor d = RecurrenceRule.resolve("hourly", Integer.toString(minute));
            for (int i = 0; i < 50; i++) {
                Instant ref = randomInstant(random);
                Instant next = d.next(ref, UTC).orElseThrow();
                assertTrue(next.isAfter(ref));
                assertFalse(next.isAfter(ref.plus(Duration.ofHours(1))), "hourly " + minute + " from " + ref);
                assertEquals(minute, ZonedDateTime.ofInstant(next, UTC).getMinute());
                assertEquals(0, ZonedDateTime.ofInstant(next, UTC).getSecond());
            }
        }
    }

    @Test
    void dailyNextAlwaysWithin24Hours() throws Exception {
        Random random = new Random(7);
        for (int i = 0; i < 500; i++) {
            int hour = random.nextInt(24);
            int minute = random.nextInt(60);
            TriggerDescriptor d = RecurrenceRule.resolve("daily", String.format("%02d:%02d", hour, minute));
            Instant ref = randomInstant(random);
            Instant next = d.next(ref, UTC).orElseThrow();
            assertTrue(next.isAfter(ref));
            assertFalse(next.isAfter(ref.plus(Duration.ofHours(24))));
            ZonedDateTime z = ZonedDateTime.ofInstant(next, UTC);
            assertEquals(hour, z.getHour());
            assertEquals(minute, z.getMinute());
        }
    }

    @Test
    void weeklyNextAlwaysWithinSevenDays() throws Exception {
        Random random = new Random(11);
        String[] days = {"monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday"};
        for (int i = 0; i < 500; i++) {
            String day = days[random.nextInt(days.length)];
            int hour = random.nextInt(24);
            int minute = random.nextInt(60);
            TriggerDescriptor d = RecurrenceRule.resolve("weekly", day + " " + hour + ":" + minute);
            Instant ref = randomInstant(random);
            Instant next = d.next(ref, UTC).orElseThrow();
            assertTrue(next.isAfter(ref));
            assertFalse(next.isAfter(ref.plus(Duration.ofDays(7))));
            ZonedDateTime z = ZonedDateTime.ofInstant(next, UTC);
            assertEquals(DayOfWeek.valueOf(day.toUpperCase()), z.getDayOfWeek());
            assertEquals(hour, z.getHour());
            assertEquals(minute, z.getMinute());
        }
    }

    @Test
    void usesZoneWallClock() throws Exception {
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");
        TriggerDescriptor d = RecurrenceRule.resolve("daily", "09:00");
        // 2024-01-01T00:30Z is 09:30 in Tokyo, so the next 09:00 local is the following day
        Instant next = d.next(Instant.parse("2024-01-01T00:30:00Z"), tokyo).orElseThrow();
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), next);
    }

    private static Instant randomInstant(Random random) {
        long base = Instant.parse("2024-01-01T00:00:00Z").getEpochSecond();
        return Instant.ofEpochSecond(base + (long) random.nextInt(3 * 365 * 24 * 3600));
    }
}

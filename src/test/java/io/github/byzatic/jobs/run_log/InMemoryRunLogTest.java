package io.github.byzatic.jobs.run_log;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRunLogTest {
    private final InMemoryRunLog log = new InMemoryRunLog();

    @Test
    void listsNewestRunTimeFirst() {
        log.append("j1", "one", Instant.parse("2024-01-01T10:00:00Z"), "a");
        log.append("j2", "two", Instant.parse("2024-01-01T12:00:00Z"), "b");
        log.append("j1", "one", Instant.parse("2024-01-01T11:00:00Z"), "c");

        List<RunLogEntry> entries = log.listDescending();
        assertEquals(List.of("b", "c", "a"), entries.stream().map(e -> e.output).toList());
    }

    @Test
    void equalRunTimes_mostRecentWriteFirst() {
        Instant t = Instant.parse("2024-01-01T10:00:00Z");
        log.append("j1", "one", t, "first");
        log.append("j1", "one", t, "second");
        log.append("j1", "one", t, "third");

        assertEquals(List.of("third", "second", "first"),
                log.listDescending().stream().map(e -> e.output).toList());
    }

    @Test
    void listForJobFiltersById() {
        log.append("j1", "one", Instant.parse("2024-01-01T10:00:00Z"), "a");
        log.append("j2", "two", Instant.parse("2024-01-01T11:00:00Z"), "b");
        log.append("j1", "one", Instant.parse("2024-01-01T12:00:00Z"), "c");

        assertEquals(List.of("c", "a"), log.listForJob("j1").stream().map(e -> e.output).toList());
        assertTrue(log.listForJob("nope").isEmpty());
    }

    @Test
    void entryKeepsJobNameSnapshot() {
        log.append("j1", "old-name", Instant.parse("2024-01-01T10:00:00Z"), "a");
        RunLogEntry e = log.listDescending().get(0);
        assertEquals("j1", e.jobId);
        assertEquals("old-name", e.jobName);
    }
}

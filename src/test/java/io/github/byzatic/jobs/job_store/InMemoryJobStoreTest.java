package io.github.byzatic.jobs.job_store;

import io.github.byzatic.jobs.base_exceptions.JobNotFoundException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {
    private final InMemoryJobStore store = new InMemoryJobStore();

    @Test
    void createAssignsFreshIdsAndEmptyRunState() {
        Job a = store.create("a", "hourly", "5", true);
        Job b = store.create("b", "daily", "10:00", false);

        assertNotNull(a.getId());
        assertNotEquals(a.getId(), b.getId());
        assertTrue(a.isEnabled());
        assertFalse(b.isEnabled());
        assertNull(a.getLastRun());
        assertNull(a.getNextRun());
        assertEquals("hourly", a.getRecurrenceType());
        assertEquals("5", a.getTimeSpec());
    }

    @Test
    void listKeepsCreationOrder() {
        Job a = store.create("a", "hourly", "5", true);
        Job b = store.create("b", "hourly", "6", true);
        Job c = store.create("c", "hourly", "7", true);
        assertEquals(List.of(a.getId(), b.getId(), c.getId()),
                store.list().stream().map(Job::getId).toList());
    }

    @Test
    void unknownIdIsNotFound() {
        assertThrows(JobNotFoundException.class, () -> store.get("missing"));
        assertThrows(JobNotFoundException.class, () -> store.setEnabled("missing", true));
        assertThrows(JobNotFoundException.class, () -> store.recordRun("missing", Instant.now(), null));
        assertThrows(JobNotFoundException.class, () -> store.setNextRun("missing", null));
        assertTrue(store.find("missing").isEmpty());
    }

    @Test
    void recordRunTouchesOnlyRunFields() throws Exception {
        Job job = store.create("backup", "daily", "02:30", true);
        Instant last = Instant.parse("2024-01-01T02:30:00Z");
        Instant next = Instant.parse("2024-01-02T02:30:00Z");

        store.recordRun(job.getId(), last, next);

        Job stored = store.get(job.getId());
        assertEquals(last, stored.getLastRun());
        assertEquals(next, stored.getNextRun());
        assertEquals("backup", stored.getName());
        assertTrue(stored.isEnabled());

        store.recordRun(job.getId(), last.plusSeconds(60), null);
        assertNull(store.get(job.getId()).getNextRun());
    }

    @Test
    void setEnabledReturnsUpdatedRecord() throws Exception {
        Job job = store.create("x", "hourly", "1", true);
        Job disabled = store.setEnabled(job.getId(), false);
        assertFalse(disabled.isEnabled());
        assertFalse(store.get(job.getId()).isEnabled());
    }

    @Test
    void returnedSnapshotsAreNotAffectedByLaterUpdates() throws Exception {
        Job job = store.create("x", "hourly", "1", true);
        store.setEnabled(job.getId(), false);
        assertTrue(job.isEnabled());
    }
}

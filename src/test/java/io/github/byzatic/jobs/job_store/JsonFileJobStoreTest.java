package io.github.byzatic.jobs.job_store;

import io.github.byzatic.jobs.base_exceptions.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileJobStoreTest {

    @TempDir
    Path dir;

    @Test
    void survivesReopen() throws Exception {
        Path file = dir.resolve("jobs.json");
        JsonFileJobStore store = new JsonFileJobStore(file);
        Job backup = store.create("backup", "daily", "02:30", true);
        Job bogus = store.create("bogus", "bogus", "x", false);
        store.recordRun(backup.getId(), Instant.parse("2024-01-01T02:30:00Z"), Instant.parse("2024-01-02T02:30:00Z"));

        JsonFileJobStore reopened = new JsonFileJobStore(file);

        assertEquals(2, reopened.list().size());
        assertEquals(store.get(backup.getId()), reopened.get(backup.getId()));
        Job bogusReloaded = reopened.get(bogus.getId());
        assertEquals("bogus", bogusReloaded.getRecurrenceType());
        assertEquals("x", bogusReloaded.getTimeSpec());
        assertFalse(bogusReloaded.isEnabled());
        assertNull(bogusReloaded.getLastRun());
    }

    @Test
    void missingFileStartsEmptyAndCreatesParentDirectories() {
        Path file = dir.resolve("nested/state/jobs.json");
        JsonFileJobStore store = new JsonFileJobStore(file);
        assertTrue(store.list().isEmpty());

        store.create("a", "hourly", "0", true);
        assertTrue(Files.exists(file));
        assertFalse(Files.exists(file.resolveSibling("jobs.json.tmp")));
    }

    @Test
    void timestampsAreWrittenAsIsoText() throws Exception {
        Path file = dir.resolve("jobs.json");
        JsonFileJobStore store = new JsonFileJobStore(file);
        Job job = store.create("a", "hourly", "0", true);
        store.setNextRun(job.getId(), Instant.parse("2024-01-01T11:00:00Z"));

        String json = Files.readString(file);
        assertTrue(json.contains("2024-01-01T11:00:00Z"), json);
        assertTrue(json.contains("\"type\":\"hourly\""), json);
    }

    @Test
    void corruptFileIsReportedAsStorageError() throws Exception {
        Path file = dir.resolve("jobs.json");
        Files.writeString(file, "{not json");
        assertThrows(StorageException.class, () -> new JsonFileJobStore(file));
    }
}

package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.MutableClock;
import io.github.byzatic.jobs.job_store.InMemoryJobStore;
import io.github.byzatic.jobs.job_store.Job;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JobRecoveryTest {

    @Test
    void armsEnabledJobsAndCountsOnlyArmedOnes() throws Exception {
        MutableClock clock = MutableClock.utc("2024-01-01T10:00:00Z");
        InMemoryJobStore store = new InMemoryJobStore();
        TriggerRegistry registry = new TriggerRegistry(clock);
        ScheduleCoordinator coordinator = new ScheduleCoordinator(store, registry, new JobLocks());

        Job daily = store.create("daily", "daily", "02:30", true);
        Job weekly = store.create("weekly", "weekly", "Mon 09:00", true);
        Job broken = store.create("broken", "daily", "25:00", true);
        Job off = store.create("off", "hourly", "5", false);

        int armed = new JobRecovery(store, coordinator, registry).recover();

        assertEquals(2, armed);
        assertEquals(Instant.parse("2024-01-02T02:30:00Z"), store.get(daily.getId()).getNextRun());
        // 2024-01-01 is a Monday and 09:00 has already passed
        assertEquals(Instant.parse("2024-01-08T09:00:00Z"), store.get(weekly.getId()).getNextRun());
        assertFalse(registry.isArmed(broken.getId()));
        assertNull(store.get(broken.getId()).getNextRun());
        assertFalse(registry.isArmed(off.getId()));
    }

    @Test
    void runningTwiceKeepsTheSameState() throws Exception {
        MutableClock clock = MutableClock.utc("2024-01-01T10:00:00Z");
        InMemoryJobStore store = new InMemoryJobStore();
        TriggerRegistry registry = new TriggerRegistry(clock);
        JobRecovery recovery = new JobRecovery(store, new ScheduleCoordinator(store, registry, new JobLocks()), registry);
        Job job = store.create("hourly", "hourly", "30", true);

        assertEquals(1, recovery.recover());
        assertEquals(1, recovery.recover());
        assertEquals(Instant.parse("2024-01-01T10:30:00Z"), store.get(job.getId()).getNextRun());
        assertEquals(1, registry.armedIds().size());
    }
}

package io.github.byzatic.jobs.schedulers;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobs.base_exceptions.InvalidRuleException;
import io.github.byzatic.jobs.base_exceptions.JobNotFoundException;
import io.github.byzatic.jobs.job_store.Job;
import io.github.byzatic.jobs.job_store.JobStoreInterface;
import io.github.byzatic.jobs.recurrence.RecurrenceRule;
import io.github.byzatic.jobs.recurrence.TriggerDescriptor;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Keeps a job's stored {@code enabled}/{@code nextRun} and its armed state in step.
 * Every method runs under the job's lock.
 */
@ThreadSafe
public final class ScheduleCoordinator {
    private final static Logger logger = LoggerFactory.getLogger(ScheduleCoordinator.class);

    private final JobStoreInterface jobStore;
    private final TriggerRegistryInterface registry;
    private final JobLocks locks;

    public ScheduleCoordinator(@NotNull JobStoreInterface jobStore, @NotNull TriggerRegistryInterface registry, @NotNull JobLocks locks) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
    }

    /**
     * Arms an enabled job, disarms a disabled one, and stores the resulting {@code nextRun}.
     */
    public @NotNull Job reconcile(@NotNull String jobId) throws JobNotFoundException {
        Lock lock = locks.forJob(jobId);
        lock.lock();
        try {
            Job job = jobStore.get(jobId);
            return job.isEnabled() ? armStored(job) : disarmStored(job);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the enabled flag and arms/disarms accordingly. Calling it twice with the same value
     * leaves the same state as calling it once.
     */
    public @NotNull Job setEnabled(@NotNull String jobId, boolean enabled) throws JobNotFoundException {
        Lock lock = locks.forJob(jobId);
        lock.lock();
        try {
            Job job = jobStore.get(jobId);
            if (job.isEnabled() != enabled) {
                job = jobStore.setEnabled(jobId, enabled);
                logger.info("Job {} ({}) {}", jobId, job.getName(), enabled ? "enabled" : "disabled");
            }
            return enabled ? armStored(job) : disarmStored(job);
        } finally {
            lock.unlock();
        }
    }

    public @NotNull Job toggle(@NotNull String jobId) throws JobNotFoundException {
        Lock lock = locks.forJob(jobId);
        lock.lock();
        try {
            return setEnabled(jobId, !jobStore.get(jobId).isEnabled());
        } finally {
            lock.unlock();
        }
    }

    private Job armStored(Job job) throws JobNotFoundException {
        Instant next;
        try {
            TriggerDescriptor descriptor = RecurrenceRule.resolve(job.getRecurrenceType(), job.getTimeSpec());
            Optional<Instant> armedAt = registry.arm(job.getId(), descriptor);
            next = armedAt.orElse(null);
        } catch (InvalidRuleException e) {
            logger.warn("Job {} ({}) stays unarmed: {}", job.getId(), job.getName(), e.getMessage());
            registry.disarm(job.getId());
            next = null;
        }
        return storeNextRun(job, next);
    }

    private Job disarmStored(Job job) throws JobNotFoundException {
        registry.disarm(job.getId());
        return storeNextRun(job, null);
    }

    private Job storeNextRun(Job job, Instant next) throws JobNotFoundException {
        if (Objects.equals(job.getNextRun(), next)) return job;
        return jobStore.setNextRun(job.getId(), next);
    }
}

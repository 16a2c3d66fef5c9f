package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.base_exceptions.JobNotFoundException;
import io.github.byzatic.jobs.base_exceptions.StorageException;
import io.github.byzatic.jobs.job_store.Job;
import io.github.byzatic.jobs.job_store.JobStoreInterface;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Startup pass over the job store: arms every enabled job and refreshes {@code nextRun} of all jobs,
 * so values left over from a previous process never survive a restart.
 * Occurrences that fell due while the process was down are not replayed.
 */
public final class JobRecovery {
    private final static Logger logger = LoggerFactory.getLogger(JobRecovery.class);

    private final JobStoreInterface jobStore;
    private final ScheduleCoordinator coordinator;
    private final TriggerRegistryInterface registry;

    public JobRecovery(@NotNull JobStoreInterface jobStore, @NotNull ScheduleCoordinator coordinator, @NotNull TriggerRegistryInterface registry) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * @return number of jobs armed
     */
    public int recover() {
        int armed = 0;
        int degraded = 0;
        for (Job job : jobStore.list()) {
            try {
                coordinator.reconcile(job.getId());
                if (registry.isArmed(job.getId())) {
                    armed++;
                } else if (job.isEnabled()) {
                    degraded++;
                }
            } catch (JobNotFoundException | StorageException e) {
                logger.error("Recovery of job {} ({}) failed, continuing", job.getId(), job.getName(), e);
            }
        }
        logger.info("Recovery armed {} job(s), {} enabled job(s) left unarmed", armed, degraded);
        return armed;
    }
}

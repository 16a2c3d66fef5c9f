package io.github.byzatic.jobs;

import io.github.byzatic.jobs.base_exceptions.JobNotFoundException;
import io.github.byzatic.jobs.base_exceptions.StorageException;
import io.github.byzatic.jobs.base_exceptions.ValidationException;
import io.github.byzatic.jobs.job_store.InMemoryJobStore;
import io.github.byzatic.jobs.job_store.Job;
import io.github.byzatic.jobs.job_store.JobStoreInterface;
import io.github.byzatic.jobs.run_log.InMemoryRunLog;
import io.github.byzatic.jobs.run_log.RunLogEntry;
import io.github.byzatic.jobs.run_log.RunLogInterface;
import io.github.byzatic.jobs.schedulers.ConstantOutputAction;
import io.github.byzatic.jobs.schedulers.Dispatcher;
import io.github.byzatic.jobs.schedulers.JobAction;
import io.github.byzatic.jobs.schedulers.JobEventListener;
import io.github.byzatic.jobs.schedulers.JobLocks;
import io.github.byzatic.jobs.schedulers.JobRecovery;
import io.github.byzatic.jobs.schedulers.ScheduleCoordinator;
import io.github.byzatic.jobs.schedulers.TriggerRegistry;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JobScheduler
 * - Recurring jobs: hourly (minute), daily (HH:MM), weekly (day HH:MM)
 * - Jobs and run history kept in pluggable stores (in-memory or JSON files)
 * - One clock loop for all jobs, actions executed on a configurable ThreadPoolExecutor
 * - Enable/disable/toggle at runtime, manual runs outside the schedule
 * - Event subscription (start/complete/error/skipped)
 */
public final class JobScheduler implements JobSchedulerInterface {
    private final static Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    private final JobStoreInterface jobStore;
    private final RunLogInterface runLog;
    private final TriggerRegistry registry;
    private final ScheduleCoordinator coordinator;
    private final JobRecovery recovery;
    private final Dispatcher dispatcher;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private JobScheduler(Builder b) {
        this.jobStore = b.jobStore;
        this.runLog = b.runLog;
        this.registry = new TriggerRegistry(b.clock);
        JobLocks locks = new JobLocks();
        this.coordinator = new ScheduleCoordinator(jobStore, registry, locks);
        this.recovery = new JobRecovery(jobStore, coordinator, registry);
        this.dispatcher = new Dispatcher(registry, jobStore, runLog, b.action, locks, b.executor, b.clock,
                b.shutdownGrace, b.listeners);
    }

    public static final class Builder {
        private JobStoreInterface jobStore;
        private RunLogInterface runLog;
        private JobAction action;
        private ThreadPoolExecutor executor;
        private Clock clock = Clock.systemDefaultZone();
        private Duration shutdownGrace = Duration.ofSeconds(10);
        private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

        /**
         * Job store; defaults to an {@link InMemoryJobStore}.
         */
        public Builder jobStore(JobStoreInterface jobStore) {
            this.jobStore = Objects.requireNonNull(jobStore);
            return this;
        }

        /**
         * Run log; defaults to an {@link InMemoryRunLog}.
         */
        public Builder runLog(RunLogInterface runLog) {
            this.runLog = Objects.requireNonNull(runLog);
            return this;
        }

        /**
         * Action executed on every run; defaults to {@link ConstantOutputAction}.
         */
        public Builder action(JobAction action) {
            this.action = Objects.requireNonNull(action);
            return this;
        }

        /**
         * Provide your own custom thread pool.
         */
        public Builder executor(ThreadPoolExecutor executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        /**
         * Clock for all fire-time computations; its zone is the scheduler's single time zone.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /**
         * How long {@link JobScheduler#close()} waits for running jobs.
         */
        public Builder shutdownGrace(Duration grace) {
            this.shutdownGrace = Objects.requireNonNull(grace);
            return this;
        }

        public Builder addListener(JobEventListener l) {
            listeners.add(Objects.requireNonNull(l));
            return this;
        }

        public JobScheduler build() {
            if (jobStore == null) jobStore = new InMemoryJobStore();
            if (runLog == null) runLog = new InMemoryRunLog();
            if (action == null) action = new ConstantOutputAction();
            if (executor == null) {
                executor = new ThreadPoolExecutor(
                        Math.max(2, Runtime.getRuntime().availableProcessors()),
                        Math.max(4, Runtime.getRuntime().availableProcessors() * 2),
                        60, TimeUnit.SECONDS,
                        new LinkedBlockingQueue<>(),
                        r -> {
                            Thread t = new Thread(r, "job-exec-" + UUID.randomUUID());
                            t.setDaemon(false);
                            t.setUncaughtExceptionHandler((th, ex) ->
                                    logger.error("Uncaught in {}", th.getName(), ex));
                            return t;
                        },
                        new ThreadPoolExecutor.CallerRunsPolicy()
                );
                executor.allowCoreThreadTimeOut(true);
            }
            return new JobScheduler(this);
        }
    }

    // ======== Lifecycle ========

    @Override
    public void start() {
        if (closed.get()) throw new IllegalStateException("Scheduler is closed");
        if (!started.compareAndSet(false, true)) return;
        recovery.recover();
        dispatcher.start();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        dispatcher.close();
    }

    // ======== Public API ========

    @Override
    public @NotNull Job createJob(String name, String type, String time, boolean enabled) throws ValidationException {
        if (name == null || name.isBlank()) throw new ValidationException("Job name must not be blank");
        if (type == null) throw new ValidationException("Job type must be set");
        if (time == null) throw new ValidationException("Job time must be set");

        Job job;
        try {
            job = jobStore.create(name, type, time, enabled);
        } catch (StorageException e) {
            logger.error("Failed to store new job '{}'", name, e);
            throw new ValidationException("Job could not be stored: " + e.getMessage(), e);
        }
        logger.info("Created job {} ({}, {} '{}', enabled={})", job.getId(), name, type, time, enabled);
        if (!enabled) return job;
        try {
            return coordinator.reconcile(job.getId());
        } catch (JobNotFoundException e) {
            // jobs are never deleted, so the record just written must exist
            throw new IllegalStateException("Created job vanished: " + job.getId(), e);
        } catch (StorageException e) {
            // armed; the next fire or the next start stores nextRun
            logger.error("Job {} was created but its next run could not be stored", job.getId(), e);
            return job;
        }
    }

    @Override
    public @NotNull Job createJob(String name, String type, String time) throws ValidationException {
        return createJob(name, type, time, true);
    }

    @Override
    public @NotNull List<Job> listJobs() {
        return jobStore.list();
    }

    @Override
    public @NotNull Job getJob(@NotNull String jobId) throws JobNotFoundException {
        return jobStore.get(jobId);
    }

    @Override
    public @NotNull RunResult runJobNow(@NotNull String jobId) {
        return dispatcher.runNow(jobId);
    }

    @Override
    public @NotNull ToggleResult toggleJob(@NotNull String jobId) {
        try {
            return ToggleResult.toggled(coordinator.toggle(jobId).isEnabled());
        } catch (JobNotFoundException e) {
            logger.debug("Toggle of unknown job {}", jobId);
            return ToggleResult.notFound();
        } catch (StorageException e) {
            return toggleFailed(jobId, e);
        }
    }

    @Override
    public @NotNull ToggleResult setJobEnabled(@NotNull String jobId, boolean enabled) {
        try {
            return ToggleResult.toggled(coordinator.setEnabled(jobId, enabled).isEnabled());
        } catch (JobNotFoundException e) {
            logger.debug("Enable/disable of unknown job {}", jobId);
            return ToggleResult.notFound();
        } catch (StorageException e) {
            return toggleFailed(jobId, e);
        }
    }

    private ToggleResult toggleFailed(String jobId, StorageException e) {
        logger.error("Failed to store enabled state of job {}", jobId, e);
        boolean stored = jobStore.find(jobId).map(Job::isEnabled).orElse(false);
        return ToggleResult.failed(stored, String.valueOf(e.getMessage()));
    }

    @Override
    public @NotNull List<RunLogEntry> listLogs() {
        return runLog.listDescending();
    }

    @Override
    public void addListener(@NotNull JobEventListener l) {
        dispatcher.addListener(l);
    }

    @Override
    public void removeListener(JobEventListener l) {
        dispatcher.removeListener(l);
    }

    /**
     * Whether the job currently has an armed trigger.
     */
    public boolean isArmed(@NotNull String jobId) {
        return registry.isArmed(jobId);
    }

    public boolean isStarted() {
        return started.get() && !closed.get();
    }
}

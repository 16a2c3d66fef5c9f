package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.RunResult;
import io.github.byzatic.jobs.base_exceptions.JobNotFoundException;
import io.github.byzatic.jobs.base_exceptions.StorageException;
import io.github.byzatic.jobs.job_store.Job;
import io.github.byzatic.jobs.job_store.JobStoreInterface;
import io.github.byzatic.jobs.run_log.RunLogInterface;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Dispatcher
 * - One daemon thread waits on the trigger registry and hands due triggers to the worker pool
 * - Runs the job action, appends to the run log, stores lastRun/nextRun, re-arms the trigger
 * - At most one execution per job at a time (scheduled and manual runs share the guard)
 * - Action failures are recorded and never stop the loop or prevent re-arming
 */
public final class Dispatcher implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(Dispatcher.class);
    static final String FAILED_OUTPUT_PREFIX = "FAILED: ";

    private final TriggerRegistryInterface registry;
    private final JobStoreInterface jobStore;
    private final RunLogInterface runLog;
    private final JobAction action;
    private final JobLocks locks;
    private final ExecutorService executor;
    private final Clock clock;
    private final long shutdownGraceMillis;
    private final List<JobEventListener> listeners;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread loopThread;

    public Dispatcher(@NotNull TriggerRegistryInterface registry,
                      @NotNull JobStoreInterface jobStore,
                      @NotNull RunLogInterface runLog,
                      @NotNull JobAction action,
                      @NotNull JobLocks locks,
                      @NotNull ExecutorService executor,
                      @NotNull Clock clock,
                      @NotNull Duration shutdownGrace,
                      @NotNull List<JobEventListener> listeners) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.runLog = Objects.requireNonNull(runLog, "runLog must not be null");
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.shutdownGraceMillis = Objects.requireNonNull(shutdownGrace, "shutdownGrace must not be null").toMillis();
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    // ======== Lifecycle ========

    /**
     * Starts the clock loop. No-op if already running.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) return;
        Thread t = new Thread(this::dispatchLoop, "job-dispatcher");
        t.setDaemon(true);
        loopThread = t;
        t.start();
        logger.info("Dispatcher started");
    }

    public boolean isStarted() {
        return running.get();
    }

    /**
     * Stops the clock loop and waits up to the grace period for running jobs.
     */
    @Override
    public void close() {
        running.set(false);
        Thread t = loopThread;
        if (t != null) t.interrupt();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Math.max(1, shutdownGraceMillis), TimeUnit.MILLISECONDS)) {
                logger.warn("Jobs still running after {} ms, interrupting", shutdownGraceMillis);
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        logger.info("Dispatcher stopped");
    }

    // ======== Listeners ========

    public void addListener(@NotNull JobEventListener l) {
        listeners.add(Objects.requireNonNull(l));
    }

    public void removeListener(JobEventListener l) {
        listeners.remove(l);
    }

    // ======== Runs ========

    public boolean isRunning(@NotNull String jobId) {
        return inFlight.contains(jobId);
    }

    /**
     * Runs a job on the caller's thread, outside its schedule. The armed trigger is left as it is;
     * the stored {@code nextRun} is refreshed from it. Never throws.
     */
    public @NotNull RunResult runNow(@NotNull String jobId) {
        Optional<Job> job;
        try {
            job = jobStore.find(jobId);
        } catch (RuntimeException e) {
            logger.error("Manual run of job {} failed to read the job", jobId, e);
            return RunResult.error(String.valueOf(e));
        }
        if (job.isEmpty()) return RunResult.error("Job not found: " + jobId);
        if (!inFlight.add(jobId)) return RunResult.error("Job is already running: " + jobId);
        try {
            Instant runAt = clock.instant();
            Execution execution = execute(job.get());
            boolean recorded = record(job.get(), runAt, execution.output, () -> registry.nextFireTime(jobId));
            if (execution.error != null) return RunResult.error(String.valueOf(execution.error));
            if (!recorded) return RunResult.error("Run of job " + jobId + " could not be recorded");
            return RunResult.ok();
        } finally {
            inFlight.remove(jobId);
        }
    }

    // ======== Internal ========

    private void dispatchLoop() {
        while (running.get()) {
            try {
                ArmedTrigger due = registry.awaitDue();
                try {
                    executor.execute(() -> fireScheduled(due));
                } catch (RejectedExecutionException rejected) {
                    if (!running.get()) break;
                    logger.warn("Worker pool rejected job {}, running it on the dispatcher thread", due.jobId);
                    fireScheduled(due);
                }
            } catch (InterruptedException ie) {
                if (!running.get()) break;
            } catch (Throwable t) {
                logger.error("Dispatcher error, continuing", t);
            }
        }
    }

    void fireScheduled(ArmedTrigger trigger) {
        String jobId = trigger.jobId;
        Optional<Job> job;
        try {
            job = jobStore.find(jobId);
        } catch (RuntimeException e) {
            logger.error("Failed to read job {}, re-arming without running it", jobId, e);
            rescheduleSkipped(trigger);
            return;
        }
        if (job.isEmpty()) {
            logger.warn("Armed job {} is missing from the store, disarming", jobId);
            registry.disarm(jobId);
            return;
        }
        Lock lock = locks.forJob(jobId);
        lock.lock();
        try {
            // may have waited in the worker queue while the job was disabled or re-armed
            if (!registry.isCurrent(trigger)) {
                logger.debug("Dropping fire of job {} at {}, its trigger was disarmed or replaced", jobId, trigger.fireAt);
                return;
            }
            if (!inFlight.add(jobId)) {
                logger.warn("Job {} ({}) is still running, skipping fire at {}", jobId, job.get().getName(), trigger.fireAt);
                fire(l -> l.onSkipped(jobId));
                rescheduleSkipped(trigger);
                return;
            }
        } finally {
            lock.unlock();
        }
        try {
            Instant firedAt = clock.instant();
            Execution execution = execute(job.get());
            record(job.get(), firedAt, execution.output, () -> registry.rearmAfterFire(trigger));
        } finally {
            inFlight.remove(jobId);
        }
    }

    private Execution execute(Job job) {
        String jobId = job.getId();
        fire(l -> l.onStart(jobId));
        try {
            String output = action.execute(job);
            fire(l -> l.onComplete(jobId, output));
            return new Execution(output, null);
        } catch (Throwable ex) {
            if (ex instanceof InterruptedException) Thread.currentThread().interrupt();
            logger.error("Job {} ({}) failed", jobId, job.getName(), ex);
            fire(l -> l.onError(jobId, ex));
            return new Execution(FAILED_OUTPUT_PREFIX + ex, ex);
        }
    }

    /**
     * Under the job lock: computes the next fire, appends the run and stores lastRun/nextRun.
     * Each step is attempted even if an earlier one failed.
     *
     * @return {@code true} if both the run log and the job record were written
     */
    private boolean record(Job job, Instant runAt, String output, Supplier<Optional<Instant>> nextFire) {
        String jobId = job.getId();
        Lock lock = locks.forJob(jobId);
        lock.lock();
        try {
            Instant next = nextFire.get().orElse(null);
            boolean ok = true;
            try {
                runLog.append(jobId, job.getName(), runAt, output);
            } catch (StorageException e) {
                logger.error("Failed to append run of job {} to the run log", jobId, e);
                ok = false;
            }
            try {
                jobStore.recordRun(jobId, runAt, next);
            } catch (JobNotFoundException | StorageException e) {
                logger.error("Failed to store run of job {}", jobId, e);
                ok = false;
            }
            logger.debug("Recorded run of job {} at {}, next run {}", jobId, runAt, next);
            return ok;
        } finally {
            lock.unlock();
        }
    }

    private void rescheduleSkipped(ArmedTrigger trigger) {
        Lock lock = locks.forJob(trigger.jobId);
        lock.lock();
        try {
            Instant next = registry.rearmAfterFire(trigger).orElse(null);
            jobStore.setNextRun(trigger.jobId, next);
        } catch (JobNotFoundException | StorageException e) {
            logger.error("Failed to store next run of skipped job {}", trigger.jobId, e);
        } finally {
            lock.unlock();
        }
    }

    private void fire(Consumer<JobEventListener> c) {
        for (JobEventListener l : listeners) {
            try {
                c.accept(l);
            } catch (Throwable t) {
                logger.warn("Job event listener {} failed", l, t);
            }
        }
    }

    private static final class Execution {
        final String output;
        final Throwable error;

        Execution(String output, Throwable error) {
            this.output = output;
            this.error = error;
        }
    }
}

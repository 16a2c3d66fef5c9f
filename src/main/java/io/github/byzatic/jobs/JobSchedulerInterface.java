package io.github.byzatic.jobs;

import io.github.byzatic.jobs.base_exceptions.JobNotFoundException;
import io.github.byzatic.jobs.base_exceptions.ValidationException;
import io.github.byzatic.jobs.job_store.Job;
import io.github.byzatic.jobs.run_log.RunLogEntry;
import io.github.byzatic.jobs.schedulers.JobEventListener;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Operations offered to the API layer.
 */
public interface JobSchedulerInterface extends AutoCloseable {

    /**
     * Arms every enabled stored job and starts the clock loop.
     */
    void start();

    /**
     * Stores a new job and arms it when enabled. Only the shape of the request is validated: an
     * unresolvable type/time still creates the job, which then stays unarmed with no next run.
     */
    @NotNull
    Job createJob(String name, String type, String time, boolean enabled) throws ValidationException;

    @NotNull
    Job createJob(String name, String type, String time) throws ValidationException;

    @NotNull
    List<Job> listJobs();

    @NotNull
    Job getJob(@NotNull String jobId) throws JobNotFoundException;

    /**
     * Runs the job now. Failures come back as {@link RunResult#error}, never as exceptions.
     */
    @NotNull
    RunResult runJobNow(@NotNull String jobId);

    @NotNull
    ToggleResult toggleJob(@NotNull String jobId);

    @NotNull
    ToggleResult setJobEnabled(@NotNull String jobId, boolean enabled);

    /**
     * Run history, newest first.
     */
    @NotNull
    List<RunLogEntry> listLogs();

    void addListener(@NotNull JobEventListener l);

    void removeListener(JobEventListener l);

    @Override
    void close();
}

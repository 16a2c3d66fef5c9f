package io.github.byzatic.jobs.job_store;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobs.base_exceptions.JobNotFoundException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of job definitions and their scheduling state.
 * Every operation is atomic for a single record; there is no delete.
 */
@ThreadSafe
public interface JobStoreInterface {

    /**
     * Assigns a fresh id, persists the job and returns the stored record.
     * {@code lastRun} and {@code nextRun} start out empty.
     */
    @NotNull
    Job create(String name, String recurrenceType, String timeSpec, boolean enabled);

    @NotNull
    Job get(@NotNull String id) throws JobNotFoundException;

    @NotNull
    Optional<Job> find(@NotNull String id);

    /**
     * All jobs in creation order.
     */
    @NotNull
    List<Job> list();

    @NotNull
    Job setEnabled(@NotNull String id, boolean enabled) throws JobNotFoundException;

    @NotNull
    Job setNextRun(@NotNull String id, @Nullable Instant nextRun) throws JobNotFoundException;

    /**
     * Updates only {@code lastRun} and {@code nextRun}. Reserved for the dispatcher.
     */
    void recordRun(@NotNull String id, @NotNull Instant lastRun, @Nullable Instant nextRun) throws JobNotFoundException;
}

package io.github.byzatic.jobs.job_store;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobs.base_exceptions.JobNotFoundException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Job store kept in process memory. Subclasses make it durable through {@link #persist(List)}.
 */
@ThreadSafe
public class InMemoryJobStore implements JobStoreInterface {
    @GuardedBy("this")
    private final Map<String, Job> jobs = new LinkedHashMap<>();

    @Override
    public synchronized @NotNull Job create(String name, String recurrenceType, String timeSpec, boolean enabled) {
        Job job = Job.newBuilder()
                .setId(UUID.randomUUID().toString())
                .setName(name)
                .setRecurrenceType(recurrenceType)
                .setTimeSpec(timeSpec)
                .setEnabled(enabled)
                .build();
        jobs.put(job.getId(), job);
        persistOrRollbackCreate(job.getId());
        return job;
    }

    @Override
    public synchronized @NotNull Job get(@NotNull String id) throws JobNotFoundException {
        Job job = jobs.get(Objects.requireNonNull(id, "id must not be null"));
        if (job == null) throw new JobNotFoundException(id);
        return job;
    }

    @Override
    public synchronized @NotNull Optional<Job> find(@NotNull String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public synchronized @NotNull List<Job> list() {
        return List.copyOf(jobs.values());
    }

    @Override
    public synchronized @NotNull Job setEnabled(@NotNull String id, boolean enabled) throws JobNotFoundException {
        return update(id, job -> Job.newBuilder(job).setEnabled(enabled).build());
    }

    @Override
    public synchronized @NotNull Job setNextRun(@NotNull String id, @Nullable Instant nextRun) throws JobNotFoundException {
        return update(id, job -> Job.newBuilder(job).setNextRun(nextRun).build());
    }

    @Override
    public synchronized void recordRun(@NotNull String id, @NotNull Instant lastRun, @Nullable Instant nextRun) throws JobNotFoundException {
        Objects.requireNonNull(lastRun, "lastRun must not be null");
        update(id, job -> Job.newBuilder(job).setLastRun(lastRun).setNextRun(nextRun).build());
    }

    /**
     * Writes the full job set to durable storage. Called with the store monitor held.
     */
    protected void persist(@NotNull List<Job> snapshot) {
    }

    /**
     * Replaces the contents, used by subclasses when loading from storage.
     */
    protected synchronized void load(@NotNull List<Job> stored) {
        jobs.clear();
        for (Job job : stored) jobs.put(job.getId(), job);
    }

    @GuardedBy("this")
    private Job update(String id, UnaryOperator<Job> change) throws JobNotFoundException {
        Job current = get(id);
        Job updated = change.apply(current);
        jobs.put(id, updated);
        try {
            persist(new ArrayList<>(jobs.values()));
        } catch (RuntimeException e) {
            jobs.put(id, current);
            throw e;
        }
        return updated;
    }

    @GuardedBy("this")
    private void persistOrRollbackCreate(String createdId) {
        try {
            persist(new ArrayList<>(jobs.values()));
        } catch (RuntimeException e) {
            jobs.remove(createdId);
            throw e;
        }
    }
}

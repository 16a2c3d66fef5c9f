package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.job_store.Job;
import org.jetbrains.annotations.NotNull;

/**
 * Work performed when a job fires. The returned text is stored as the run's output.
 * Throwing marks the run as failed; scheduling continues either way.
 */
@FunctionalInterface
public interface JobAction {
    String execute(@NotNull Job job) throws Exception;
}

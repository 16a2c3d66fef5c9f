package io.github.byzatic.jobs.run_log;

import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * Append-only execution history. Entries are never changed or removed.
 */
@ThreadSafe
public interface RunLogInterface {

    void append(@NotNull String jobId, String jobName, @NotNull Instant runTime, String output);

    /**
     * All entries, newest {@code runTime} first; equal run times are ordered most recent write first.
     */
    @NotNull
    List<RunLogEntry> listDescending();

    /**
     * Same ordering as {@link #listDescending()}, restricted to one job id.
     */
    @NotNull
    List<RunLogEntry> listForJob(@NotNull String jobId);
}

package io.github.byzatic.jobs.run_log;

import com.google.common.collect.Lists;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Run log held in process memory. Subclasses make appends durable through {@link #persist(RunLogEntry)}.
 */
@ThreadSafe
public class InMemoryRunLog implements RunLogInterface {
    private static final Comparator<RunLogEntry> NEWEST_FIRST =
            Comparator.comparing((RunLogEntry e) -> e.runTime).reversed();

    @GuardedBy("this")
    private final List<RunLogEntry> entries = new ArrayList<>();

    @Override
    public synchronized void append(@NotNull String jobId, String jobName, @NotNull Instant runTime, String output) {
        RunLogEntry entry = new RunLogEntry(jobId, jobName, runTime, output);
        persist(entry);
        entries.add(entry);
    }

    @Override
    public synchronized @NotNull List<RunLogEntry> listDescending() {
        return sortNewestFirst(entries);
    }

    @Override
    public synchronized @NotNull List<RunLogEntry> listForJob(@NotNull String jobId) {
        List<RunLogEntry> matching = new ArrayList<>();
        for (RunLogEntry e : entries) {
            if (e.jobId.equals(jobId)) matching.add(e);
        }
        return sortNewestFirst(matching);
    }

    /**
     * Writes one entry to durable storage before it becomes visible. Called with the log monitor held.
     */
    protected void persist(@NotNull RunLogEntry entry) {
    }

    protected synchronized void load(@NotNull List<RunLogEntry> stored) {
        entries.clear();
        entries.addAll(stored);
    }

    private static List<RunLogEntry> sortNewestFirst(List<RunLogEntry> inInsertionOrder) {
        // reversed insertion order + stable sort keeps the latest write first among equal run times
        List<RunLogEntry> out = new ArrayList<>(Lists.reverse(inInsertionOrder));
        out.sort(NEWEST_FIRST);
        return List.copyOf(out);
    }
}

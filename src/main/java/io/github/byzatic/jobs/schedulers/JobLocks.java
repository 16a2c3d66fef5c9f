package io.github.byzatic.jobs.schedulers;

import com.google.common.util.concurrent.Striped;
import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.locks.Lock;

/**
 * Per-job mutual exclusion for the read-state / arm-or-disarm / persist sequences.
 * Locks are reentrant; distinct jobs may share a stripe.
 */
@ThreadSafe
public final class JobLocks {
    private static final int DEFAULT_STRIPES = 64;

    private final Striped<Lock> stripes;

    public JobLocks() {
        this(DEFAULT_STRIPES);
    }

    public JobLocks(int stripes) {
        this.stripes = Striped.lock(stripes);
    }

    public @NotNull Lock forJob(@NotNull String jobId) {
        return stripes.get(jobId);
    }
}

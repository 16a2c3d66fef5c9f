package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.recurrence.TriggerDescriptor;

import java.time.Instant;

/**
 * A job's live trigger (read-only).
 */
public final class ArmedTrigger {
    public final String jobId;
    public final TriggerDescriptor descriptor;
    public final long generation;
    public final Instant fireAt;

    ArmedTrigger(String jobId, TriggerDescriptor descriptor, long generation, Instant fireAt) {
        this.jobId = jobId;
        this.descriptor = descriptor;
        this.generation = generation;
        this.fireAt = fireAt;
    }

    @Override
    public String toString() {
        return "ArmedTrigger{jobId='" + jobId + "', rule='" + descriptor.describe() + "', generation=" + generation +
                ", fireAt=" + fireAt + '}';
    }
}

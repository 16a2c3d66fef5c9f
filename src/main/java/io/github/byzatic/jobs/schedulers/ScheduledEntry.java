package io.github.byzatic.jobs.schedulers;

import java.time.Clock;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * Queue element of the trigger registry. An entry is only honoured while its generation
 * matches the job's current armed trigger.
 */
final class ScheduledEntry implements Delayed {
    final String jobId;
    final long generation;
    final long triggerAtMillis;
    private final Clock clock;

    ScheduledEntry(String jobId, long generation, long triggerAtMillis, Clock clock) {
        this.jobId = jobId;
        this.generation = generation;
        this.triggerAtMillis = triggerAtMillis;
        this.clock = clock;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        long diff = triggerAtMillis - clock.millis();
        return unit.convert(diff, TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed o) {
        ScheduledEntry other = (ScheduledEntry) o;
        int byTime = Long.compare(this.triggerAtMillis, other.triggerAtMillis);
        return byTime != 0 ? byTime : Long.compare(this.generation, other.generation);
    }

    @Override
    public String toString() {
        return "ScheduledEntry{jobId='" + jobId + "', generation=" + generation + ", triggerAtMillis=" + triggerAtMillis + '}';
    }
}

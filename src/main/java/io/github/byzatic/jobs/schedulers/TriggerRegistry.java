package io.github.byzatic.jobs.schedulers;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobs.recurrence.TriggerDescriptor;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.DelayQueue;

/**
 * Trigger registry on top of a {@link DelayQueue}.
 * <p>
 * Each arm gets a new generation number. The queue may still hold entries of older generations
 * (removal is best effort); {@link #awaitDue()} drops them when they surface, so a replaced or
 * disarmed trigger never fires.
 */
@ThreadSafe
public final class TriggerRegistry implements TriggerRegistryInterface {
    private final static Logger logger = LoggerFactory.getLogger(TriggerRegistry.class);

    private final Clock clock;
    private final DelayQueue<ScheduledEntry> queue = new DelayQueue<>();

    @GuardedBy("this")
    private final Map<String, ArmedTrigger> armed = new HashMap<>();
    @GuardedBy("this")
    private final Map<String, ScheduledEntry> pending = new HashMap<>();
    @GuardedBy("this")
    private long generations = 0;

    public TriggerRegistry(@NotNull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public @NotNull Clock getClock() {
        return clock;
    }

    @Override
    public synchronized @NotNull Optional<Instant> arm(@NotNull String jobId, @NotNull TriggerDescriptor descriptor) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Optional<Instant> next = descriptor.next(clock.instant(), clock.getZone());
        if (next.isEmpty()) {
            logger.warn("Job {} has no next fire time for rule '{}', leaving it unarmed", jobId, descriptor.describe());
            disarm(jobId);
            return Optional.empty();
        }
        armAt(jobId, descriptor, next.get());
        logger.debug("Armed job {} ({}) for {}", jobId, descriptor.describe(), next.get());
        return next;
    }

    @Override
    public synchronized boolean disarm(@NotNull String jobId) {
        ArmedTrigger removed = armed.remove(jobId);
        ScheduledEntry entry = pending.remove(jobId);
        if (entry != null) queue.remove(entry);
        if (removed != null) logger.debug("Disarmed job {}", jobId);
        return removed != null;
    }

    @Override
    public synchronized boolean isArmed(@NotNull String jobId) {
        return armed.containsKey(jobId);
    }

    @Override
    public synchronized @NotNull Optional<Instant> nextFireTime(@NotNull String jobId) {
        ArmedTrigger t = armed.get(jobId);
        if (t == null) return Optional.empty();
        Instant now = clock.instant();
        if (t.fireAt.isAfter(now)) return Optional.of(t.fireAt);
        // due or firing: report what rearmAfterFire will pick
        return t.descriptor.next(now, clock.getZone());
    }

    @Override
    public synchronized boolean isCurrent(@NotNull ArmedTrigger trigger) {
        ArmedTrigger current = armed.get(trigger.jobId);
        return current != null && current.generation == trigger.generation;
    }

    @Override
    public synchronized @NotNull Set<String> armedIds() {
        return Set.copyOf(armed.keySet());
    }

    @Override
    public @NotNull ArmedTrigger awaitDue() throws InterruptedException {
        while (true) {
            ScheduledEntry entry = queue.take();
            synchronized (this) {
                ArmedTrigger t = armed.get(entry.jobId);
                if (t != null && t.generation == entry.generation) {
                    pending.remove(entry.jobId);
                    return t;
                }
            }
            logger.trace("Dropped stale {}", entry);
        }
    }

    @Override
    public synchronized @NotNull Optional<Instant> rearmAfterFire(@NotNull ArmedTrigger fired) {
        if (!isCurrent(fired)) {
            // disarmed or replaced while the fire was in flight
            return nextFireTime(fired.jobId);
        }
        return arm(fired.jobId, fired.descriptor);
    }

    @GuardedBy("this")
    private void armAt(String jobId, TriggerDescriptor descriptor, Instant fireAt) {
        ScheduledEntry previous = pending.remove(jobId);
        if (previous != null) queue.remove(previous);

        long generation = ++generations;
        ScheduledEntry entry = new ScheduledEntry(jobId, generation, fireAt.toEpochMilli(), clock);
        armed.put(jobId, new ArmedTrigger(jobId, descriptor, generation, fireAt));
        pending.put(jobId, entry);
        queue.offer(entry);
    }
}

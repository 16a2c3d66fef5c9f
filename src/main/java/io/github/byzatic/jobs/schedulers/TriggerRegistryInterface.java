package io.github.byzatic.jobs.schedulers;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobs.recurrence.TriggerDescriptor;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Live set of armed triggers; the only authority on whether a job is currently armed.
 */
@ThreadSafe
public interface TriggerRegistryInterface {

    /**
     * Arms {@code jobId} at the next fire time of {@code descriptor}, replacing any trigger already
     * armed for it. The replaced trigger never fires.
     *
     * @return the scheduled fire time, or empty if the descriptor produced none (the job is then unarmed)
     */
    @NotNull
    Optional<Instant> arm(@NotNull String jobId, @NotNull TriggerDescriptor descriptor);

    /**
     * @return {@code false} if the job was not armed
     */
    boolean disarm(@NotNull String jobId);

    boolean isArmed(@NotNull String jobId);

    /**
     * Pending fire time of the job. Once the armed instant has passed, this is the occurrence the
     * trigger re-arms to, so a caller never sees a fire time in the past.
     */
    @NotNull
    Optional<Instant> nextFireTime(@NotNull String jobId);

    /**
     * @return {@code true} if {@code trigger} is still the job's armed trigger, i.e. it was neither
     * disarmed nor replaced since it was handed out
     */
    boolean isCurrent(@NotNull ArmedTrigger trigger);

    @NotNull
    Set<String> armedIds();

    /**
     * Blocks until some armed trigger is due and returns it. The trigger stays registered until
     * {@link #rearmAfterFire(ArmedTrigger)} or {@link #disarm(String)}.
     */
    @NotNull
    ArmedTrigger awaitDue() throws InterruptedException;

    /**
     * Re-arms a trigger that has just fired, from the current clock; elapsed occurrences are skipped.
     * If the trigger was disarmed or replaced meanwhile nothing is re-armed.
     *
     * @return the job's next fire time after this call, empty if it is unarmed
     */
    @NotNull
    Optional<Instant> rearmAfterFire(@NotNull ArmedTrigger fired);
}

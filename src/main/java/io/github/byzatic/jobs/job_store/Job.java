package io.github.byzatic.jobs.job_store;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * Job definition plus its mutable scheduling state, as an immutable snapshot.
 * {@code recurrenceType} and {@code timeSpec} are kept verbatim, even when they do not resolve.
 */
public final class Job {
    private final String id;
    private final String name;
    private final String recurrenceType;
    private final String timeSpec;
    private final boolean enabled;
    private final Instant lastRun;
    private final Instant nextRun;

    private Job(Builder builder) {
        id = Objects.requireNonNull(builder.id, "id must not be null");
        name = builder.name;
        recurrenceType = builder.recurrenceType;
        timeSpec = builder.timeSpec;
        enabled = builder.enabled;
        lastRun = builder.lastRun;
        nextRun = builder.nextRun;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder newBuilder(Job copy) {
        Builder builder = new Builder();
        builder.id = copy.id;
        builder.name = copy.name;
        builder.recurrenceType = copy.recurrenceType;
        builder.timeSpec = copy.timeSpec;
        builder.enabled = copy.enabled;
        builder.lastRun = copy.lastRun;
        builder.nextRun = copy.nextRun;
        return builder;
    }

    public @NotNull String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getRecurrenceType() {
        return recurrenceType;
    }

    public String getTimeSpec() {
        return timeSpec;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public @Nullable Instant getLastRun() {
        return lastRun;
    }

    public @Nullable Instant getNextRun() {
        return nextRun;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Job job = (Job) o;
        return enabled == job.enabled
                && id.equals(job.id)
                && Objects.equals(name, job.name)
                && Objects.equals(recurrenceType, job.recurrenceType)
                && Objects.equals(timeSpec, job.timeSpec)
                && Objects.equals(lastRun, job.lastRun)
                && Objects.equals(nextRun, job.nextRun);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, recurrenceType, timeSpec, enabled, lastRun, nextRun);
    }

    @Override
    public String toString() {
        return "Job{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", recurrenceType='" + recurrenceType + '\'' +
                ", timeSpec='" + timeSpec + '\'' +
                ", enabled=" + enabled +
                ", lastRun=" + lastRun +
                ", nextRun=" + nextRun +
                '}';
    }

    /**
     * {@code Job} builder static inner class.
     */
    public static final class Builder {
        private String id;
        private String name;
        private String recurrenceType;
        private String timeSpec;
        private boolean enabled = true;
        private Instant lastRun;
        private Instant nextRun;

        private Builder() {
        }

        public Builder setId(String id) {
            this.id = id;
            return this;
        }

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder setRecurrenceType(String recurrenceType) {
            this.recurrenceType = recurrenceType;
            return this;
        }

        public Builder setTimeSpec(String timeSpec) {
            this.timeSpec = timeSpec;
            return this;
        }

        public Builder setEnabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder setLastRun(@Nullable Instant lastRun) {
            this.lastRun = lastRun;
            return this;
        }

        public Builder setNextRun(@Nullable Instant nextRun) {
            this.nextRun = nextRun;
            return this;
        }

        /**
         * Returns a {@code Job} built from the parameters previously set.
         *
         * @return a {@code Job} built with parameters of this {@code Job.Builder}
         */
        public Job build() {
            return new Job(this);
        }
    }
}

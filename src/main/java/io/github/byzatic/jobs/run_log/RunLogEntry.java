package io.github.byzatic.jobs.run_log;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Objects;

/**
 * One execution of a job. {@code jobName} is a copy taken at run time and is never refreshed
 * from the job record.
 */
public final class RunLogEntry {
    public final String jobId;
    public final String jobName;
    public final Instant runTime;
    public final String output;

    @JsonCreator
    public RunLogEntry(@JsonProperty("jobId") @NotNull String jobId,
                       @JsonProperty("jobName") String jobName,
                       @JsonProperty("runTime") @NotNull Instant runTime,
                       @JsonProperty("output") String output) {
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
        this.jobName = jobName;
        this.runTime = Objects.requireNonNull(runTime, "runTime must not be null");
        this.output = output;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunLogEntry that = (RunLogEntry) o;
        return jobId.equals(that.jobId)
                && Objects.equals(jobName, that.jobName)
                && runTime.equals(that.runTime)
                && Objects.equals(output, that.output);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, jobName, runTime, output);
    }

    @Override
    public String toString() {
        return "RunLogEntry{jobId='" + jobId + "', jobName='" + jobName + "', runTime=" + runTime +
                ", output='" + output + "'}";
    }
}

package io.github.byzatic.jobs.job_store;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Stored shape of a {@link Job} in the JSON job file.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public class JobDocument {
    private String id;
    private String name;
    private String type;
    private String time;
    private boolean enabled;
    private Instant lastRun;
    private Instant nextRun;

    static JobDocument fromJob(Job job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.getId());
        doc.setName(job.getName());
        doc.setType(job.getRecurrenceType());
        doc.setTime(job.getTimeSpec());
        doc.setEnabled(job.isEnabled());
        doc.setLastRun(job.getLastRun());
        doc.setNextRun(job.getNextRun());
        return doc;
    }

    Job toJob() {
        return Job.newBuilder()
                .setId(id)
                .setName(name)
                .setRecurrenceType(type)
                .setTimeSpec(time)
                .setEnabled(enabled)
                .setLastRun(lastRun)
                .setNextRun(nextRun)
                .build();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getTime() {
        return time;
    }

    public void setTime(String time) {
        this.time = time;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }

    public Instant getNextRun() {
        return nextRun;
    }

    public void setNextRun(Instant nextRun) {
        this.nextRun = nextRun;
    }
}

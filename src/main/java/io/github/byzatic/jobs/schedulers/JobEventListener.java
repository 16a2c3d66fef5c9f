package io.github.byzatic.jobs.schedulers;

/**
 * Job execution event listener. Callbacks run on the thread executing the job.
 */
public interface JobEventListener {
    default void onStart(String jobId) {
    }

    default void onComplete(String jobId, String output) {
    }

    default void onError(String jobId, Throwable error) {
    }

    /**
     * A due fire was skipped because the previous run of the same job had not finished.
     */
    default void onSkipped(String jobId) {
    }
}

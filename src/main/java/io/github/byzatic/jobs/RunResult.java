package io.github.byzatic.jobs;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a manual run: either a status message or an error message.
 */
public final class RunResult {
    public static final String TRIGGERED = "Job triggered manually";

    public final String status;
    public final String error;

    private RunResult(String status, String error) {
        this.status = status;
        this.error = error;
    }

    public static RunResult ok() {
        return new RunResult(TRIGGERED, null);
    }

    public static RunResult error(String message) {
        return new RunResult(null, message == null ? "unknown error" : message);
    }

    public boolean isOk() {
        return error == null;
    }

    public @Nullable String getStatus() {
        return status;
    }

    public @Nullable String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "RunResult{status='" + status + "'}" : "RunResult{error='" + error + "'}";
    }
}

package io.github.byzatic.jobs;

/**
 * Outcome of toggling or explicitly enabling/disabling a job.
 */
public final class ToggleResult {
    public static final String TOGGLED = "Toggled";
    public static final String NOT_FOUND = "Job not found";
    public static final String FAILED = "Toggle failed";

    public final String status;
    public final boolean found;
    public final boolean enabled;
    public final String error;

    private ToggleResult(String status, boolean found, boolean enabled, String error) {
        this.status = status;
        this.found = found;
        this.enabled = enabled;
        this.error = error;
    }

    public static ToggleResult toggled(boolean enabled) {
        return new ToggleResult(TOGGLED, true, enabled, null);
    }

    public static ToggleResult notFound() {
        return new ToggleResult(NOT_FOUND, false, false, null);
    }

    /**
     * The job exists but its new state could not be stored; {@code enabled} is the stored value.
     */
    public static ToggleResult failed(boolean enabled, String error) {
        return new ToggleResult(FAILED, true, enabled, error == null ? "unknown error" : error);
    }

    public boolean isFound() {
        return found;
    }

    public boolean isOk() {
        return found && error == null;
    }

    @Override
    public String toString() {
        if (!found) return "ToggleResult{status='" + status + "'}";
        if (error != null) return "ToggleResult{status='" + status + "', error='" + error + "'}";
        return "ToggleResult{status='" + status + "', enabled=" + enabled + '}';
    }
}

package io.github.byzatic.jobs.base_exceptions;

/**
 * Recurrence type or time spec could not be resolved into a trigger.
 * Non-fatal: the job is kept but stays unarmed.
 */
public class InvalidRuleException extends Exception {
    private final String recurrenceType;
    private final String timeSpec;

    public InvalidRuleException(String recurrenceType, String timeSpec, String message) {
        super(message + " (type='" + recurrenceType + "', time='" + timeSpec + "')");
        this.recurrenceType = recurrenceType;
        this.timeSpec = timeSpec;
    }

    public InvalidRuleException(String recurrenceType, String timeSpec, String message, Throwable cause) {
        super(message + " (type='" + recurrenceType + "', time='" + timeSpec + "')", cause);
        this.recurrenceType = recurrenceType;
        this.timeSpec = timeSpec;
    }

    public String getRecurrenceType() {
        return recurrenceType;
    }

    public String getTimeSpec() {
        return timeSpec;
    }
}

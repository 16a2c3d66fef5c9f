package io.github.byzatic.jobs.base_exceptions;

/**
 * Request was not accepted: its shape is wrong (blank job name, missing recurrence type or time)
 * or the job could not be stored.
 */
public class ValidationException extends Exception {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

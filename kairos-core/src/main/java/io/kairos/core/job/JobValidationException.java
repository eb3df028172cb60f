package io.kairos.core.job;

/**
 * Raised synchronously when a schedule or payload breaks a job invariant.
 */
public class JobValidationException extends KairosException {
    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

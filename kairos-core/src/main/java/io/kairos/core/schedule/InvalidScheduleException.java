package io.kairos.core.schedule;

import io.kairos.core.job.JobValidationException;

public final class InvalidScheduleException extends JobValidationException {
    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.kairos.core.store;

import io.kairos.core.job.KairosException;

public class JobStoreException extends KairosException {
    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

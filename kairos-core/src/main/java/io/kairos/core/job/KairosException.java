package io.kairos.core.job;

public class KairosException extends RuntimeException {
    public KairosException(String message) {
        super(message);
    }

    public KairosException(String message, Throwable cause) {
        super(message, cause);
    }
}

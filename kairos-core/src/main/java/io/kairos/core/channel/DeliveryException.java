package io.kairos.core.channel;

/**
 * A channel refused or failed to deliver a job's response.
 */
public final class DeliveryException extends Exception {
    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

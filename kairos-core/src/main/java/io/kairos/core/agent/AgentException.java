package io.kairos.core.agent;

/**
 * The agent could not produce a response for a job.
 */
public final class AgentException extends Exception {
    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}

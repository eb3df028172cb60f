package io.kairos.core.agent;

import java.time.Duration;

public interface AgentClient {
    String name();

    /**
     * Submits {@code message} and returns the agent's response text.
     *
     * @param timeout upper bound for the whole call, retries included
     */
    String submit(String message, AgentSession session, Duration timeout) throws AgentException;
}

package io.kairos.core.agent;

import java.time.Duration;

/**
 * Stand-in used when no agent endpoint is configured. Every job run fails with the reason.
 */
public final class DisabledAgentClient implements AgentClient {
    private final String reason;

    public DisabledAgentClient(String reason) {
        this.reason = reason == null || reason.isBlank() ? "agent is disabled" : reason;
    }

    @Override
    public String name() {
        return "disabled";
    }

    @Override
    public String submit(String message, AgentSession session, Duration timeout) throws AgentException {
        throw new AgentException("agent is not configured (" + reason + ")");
    }
}

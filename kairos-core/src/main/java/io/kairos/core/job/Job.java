package io.kairos.core.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Job(
    String id,
    String name,
    JobSchedule schedule,
    JobPayload payload,
    JobState state,
    long createdAtMs,
    long updatedAtMs
) {
    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }

    public boolean enabled() {
        return state.enabled();
    }

    public boolean isDue(long nowMs) {
        return state.enabled() && state.nextRunAtMs() != null && state.nextRunAtMs() <= nowMs;
    }

    public Job withState(JobState newState, long nowMs) {
        return new Job(id, name, schedule, payload, newState, createdAtMs, nowMs);
    }
}

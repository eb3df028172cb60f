package io.kairos.core.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobState(
    boolean enabled,
    Long nextRunAtMs,
    Long lastRunAtMs,
    JobStatus lastStatus,
    String lastError,
    DeliveryStatus lastDeliveryStatus,
    Long lastDurationMs
) {

    public static JobState scheduled(Long nextRunAtMs) {
        return new JobState(true, nextRunAtMs, null, null, null, null, null);
    }

    public JobState withEnabled(boolean value, Long nextRun) {
        return new JobState(value, nextRun, lastRunAtMs, lastStatus, lastError, lastDeliveryStatus, lastDurationMs);
    }

    public JobState withNextRun(Long nextRun) {
        return new JobState(enabled, nextRun, lastRunAtMs, lastStatus, lastError, lastDeliveryStatus, lastDurationMs);
    }

    public JobState withOutcome(
        long runAtMs,
        JobStatus status,
        String error,
        DeliveryStatus deliveryStatus,
        long durationMs
    ) {
        return new JobState(enabled, nextRunAtMs, runAtMs, status, error, deliveryStatus, durationMs);
    }
}

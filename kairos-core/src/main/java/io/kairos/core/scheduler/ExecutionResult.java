package io.kairos.core.scheduler;

import io.kairos.core.job.DeliveryStatus;
import io.kairos.core.job.JobStatus;

/**
 * Outcome of one execution. {@code error} carries the agent failure, the delivery failure, or both.
 */
public record ExecutionResult(
    String jobId,
    String jobName,
    long startedAtMs,
    long finishedAtMs,
    JobStatus status,
    String response,
    String error,
    DeliveryStatus deliveryStatus,
    String deliveryError
) {

    public long durationMs() {
        return Math.max(0, finishedAtMs - startedAtMs);
    }

    public boolean succeeded() {
        return status == JobStatus.SUCCESS;
    }
}

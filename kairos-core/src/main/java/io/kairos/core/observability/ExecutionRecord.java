package io.kairos.core.observability;

import io.kairos.core.job.DeliveryStatus;
import io.kairos.core.job.JobStatus;
import io.kairos.core.scheduler.ExecutionResult;
import java.time.Instant;

public record ExecutionRecord(
    String jobId,
    String jobName,
    Instant startedAt,
    long durationMs,
    boolean forced,
    JobStatus status,
    String error,
    DeliveryStatus deliveryStatus
) {

    public static ExecutionRecord of(ExecutionResult result, boolean forced) {
        return new ExecutionRecord(
            result.jobId(),
            result.jobName(),
            Instant.ofEpochMilli(result.startedAtMs()),
            result.durationMs(),
            forced,
            result.status(),
            result.error(),
            result.deliveryStatus()
        );
    }
}

package io.kairos.core.bus;

import java.time.Instant;
import java.util.Locale;

public record JobEvent(
    JobEventType type,
    String jobId,
    String jobName,
    Instant timestamp,
    String detail
) {
    public JobEvent {
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        detail = detail == null ? "" : detail;
    }

    public String describe() {
        String label = jobName == null || jobName.isBlank() ? jobId : jobName + " (" + jobId + ")";
        String suffix = detail.isBlank() ? "" : ": " + detail;
        return timestamp + " " + type.name().toLowerCase(Locale.ROOT) + " " + label + suffix;
    }
}

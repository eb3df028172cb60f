package io.kairos.core.bus;

import io.kairos.core.job.DeliveryStatus;
import io.kairos.core.job.Job;
import io.kairos.core.scheduler.ExecutionResult;
import io.kairos.core.scheduler.SchedulerListener;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Publishes execution progress onto a {@link JobEventBus}.
 */
public final class JobEventListener implements SchedulerListener {
    private final JobEventBus bus;
    private final Clock clock;

    public JobEventListener(JobEventBus bus, Clock clock) {
        this.bus = Objects.requireNonNull(bus, "bus must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void onStarted(Job job, boolean forced) {
        bus.publish(new JobEvent(JobEventType.STARTED, job.id(), job.name(), clock.instant(), forced ? "forced" : ""));
    }

    @Override
    public void onFinished(Job job, ExecutionResult result, boolean forced) {
        Instant at = Instant.ofEpochMilli(result.finishedAtMs());
        if (!result.succeeded()) {
            bus.publish(new JobEvent(JobEventType.FAILED, job.id(), job.name(), at, result.error()));
            return;
        }
        bus.publish(new JobEvent(JobEventType.SUCCEEDED, job.id(), job.name(), at, result.durationMs() + " ms"));
        if (result.deliveryStatus() == DeliveryStatus.FAILED) {
            bus.publish(new JobEvent(JobEventType.DELIVERY_FAILED, job.id(), job.name(), at, result.deliveryError()));
        }
    }
}

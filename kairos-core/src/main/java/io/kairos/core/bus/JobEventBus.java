package io.kairos.core.bus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public interface JobEventBus {
    void publish(JobEvent event);

    /**
     * Removes the oldest pending event, waiting up to {@code timeout} for one to arrive.
     */
    Optional<JobEvent> poll(Duration timeout) throws InterruptedException;

    /**
     * Most recent events first, without consuming them.
     */
    List<JobEvent> recent(int limit);

    JobEventBus NOOP = new JobEventBus() {
        @Override
        public void publish(JobEvent event) {
        }

        @Override
        public Optional<JobEvent> poll(Duration timeout) {
            return Optional.empty();
        }

        @Override
        public List<JobEvent> recent(int limit) {
            return List.of();
        }
    };
}

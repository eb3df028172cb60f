package io.kairos.core.scheduler;

import io.kairos.core.job.Job;

/**
 * Observes executions. Callbacks run on worker threads and must not block.
 */
public interface SchedulerListener {

    default void onStarted(Job job, boolean forced) {
    }

    void onFinished(Job job, ExecutionResult result, boolean forced);
}

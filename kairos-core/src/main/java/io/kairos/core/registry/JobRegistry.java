package io.kairos.core.registry;

import io.kairos.core.job.Job;
import io.kairos.core.job.JobPayload;
import io.kairos.core.job.JobSchedule;
import java.util.List;

/**
 * Synchronous job management surface.
 *
 * <p>Validation problems raise {@link io.kairos.core.job.JobValidationException}, unknown ids raise
 * {@link io.kairos.core.job.JobNotFoundException}, and store failures raise
 * {@link io.kairos.core.store.JobStoreException}.
 */
public interface JobRegistry {

    Job addJob(String name, JobSchedule schedule, JobPayload payload);

    /**
     * Jobs ordered by creation time, then id.
     */
    List<Job> listJobs(boolean includeDisabled);

    Job getJob(String id);

    Job enableJob(String id, boolean enabled);

    void removeJob(String id);

    /**
     * Executes a job immediately and waits for it to finish.
     *
     * @return {@code true} when the job ran and succeeded
     */
    boolean runJob(String id, boolean force) throws InterruptedException;
}

package io.kairos.core.store;

import io.kairos.core.job.Job;
import java.io.IOException;
import java.util.List;

/**
 * Durable home of the whole job collection. {@link #save} replaces the collection atomically.
 */
public interface JobStore {
    List<Job> load() throws IOException;

    void save(List<Job> jobs) throws IOException;
}

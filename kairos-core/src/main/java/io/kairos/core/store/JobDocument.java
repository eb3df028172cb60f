package io.kairos.core.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.job.Job;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobDocument(int version, List<Job> jobs) {
    public static final int CURRENT_VERSION = 1;

    public JobDocument {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }
}

package io.kairos.core.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kairos.core.job.JobPayload;
import io.kairos.core.job.JobSchedule;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AddJobRequest(String name, JobSchedule schedule, JobPayload payload) {
}

package io.kairos.core.agent;

import io.kairos.core.job.Job;

/**
 * Identity passed along with a job's message so the agent can keep per-job context.
 */
public record AgentSession(String jobId, String jobName, String sessionKey) {

    public static AgentSession forJob(Job job) {
        return new AgentSession(job.id(), job.name(), "cron:" + job.id());
    }
}

package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    @JsonAlias({"store_path"}) String storePath,
    @JsonAlias({"default_timezone"}) String defaultTimezone,
    @JsonAlias({"agent_timeout_seconds"}) int agentTimeoutSeconds,
    @JsonAlias({"delivery_timeout_seconds"}) int deliveryTimeoutSeconds,
    @JsonAlias({"store_timeout_seconds"}) int storeTimeoutSeconds,
    @JsonAlias({"shutdown_grace_seconds"}) int shutdownGraceSeconds,
    @JsonAlias({"max_concurrent_jobs"}) int maxConcurrentJobs,
    @JsonAlias({"history_size"}) int historySize,
    @JsonAlias({"event_buffer_size"}) int eventBufferSize
) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig("~/.kairos/cron/jobs.json", "", 120, 30, 10, 30, 4, 200, 500);
    }

    public Duration agentTimeout() {
        return Duration.ofSeconds(Math.max(1, agentTimeoutSeconds));
    }

    public Duration deliveryTimeout() {
        return Duration.ofSeconds(Math.max(1, deliveryTimeoutSeconds));
    }

    public Duration storeTimeout() {
        return Duration.ofSeconds(Math.max(1, storeTimeoutSeconds));
    }

    public Duration shutdownGrace() {
        return Duration.ofSeconds(Math.max(0, shutdownGraceSeconds));
    }
}

package io.kairos.cli;

import io.kairos.core.job.Job;
import io.kairos.core.job.JobPayload;
import io.kairos.core.job.JobState;
import java.time.Instant;
import java.util.Locale;

final class JobFormatter {

    private JobFormatter() {
    }

    static String summary(Job job) {
        JobState state = job.state();
        StringBuilder line = new StringBuilder()
            .append(job.id()).append("  ")
            .append(job.name()).append("  ")
            .append(job.schedule().describe()).append("  ")
            .append(state.enabled() ? "enabled" : "disabled")
            .append("  next=").append(time(state.nextRunAtMs()));
        if (state.lastStatus() != null) {
            line.append("  last=").append(state.lastStatus().name().toLowerCase(Locale.ROOT))
                .append('@').append(time(state.lastRunAtMs()));
        }
        return line.toString();
    }

    static String details(Job job) {
        JobState state = job.state();
        JobPayload payload = job.payload();
        StringBuilder out = new StringBuilder()
            .append("Id: ").append(job.id()).append(System.lineSeparator())
            .append("Name: ").append(job.name()).append(System.lineSeparator())
            .append("Schedule: ").append(job.schedule().describe()).append(System.lineSeparator())
            .append("Enabled: ").append(state.enabled()).append(System.lineSeparator())
            .append("Next run: ").append(time(state.nextRunAtMs())).append(System.lineSeparator())
            .append("Last run: ").append(time(state.lastRunAtMs())).append(System.lineSeparator());
        if (payload.deliver()) {
            out.append("Delivers to: ").append(payload.channel()).append(':').append(payload.recipient())
                .append(System.lineSeparator());
        }
        if (state.lastError() != null) {
            out.append("Last error: ").append(state.lastError()).append(System.lineSeparator());
        }
        return out.toString().stripTrailing();
    }

    static String time(Long epochMs) {
        return epochMs == null ? "-" : Instant.ofEpochMilli(epochMs).toString();
    }
}

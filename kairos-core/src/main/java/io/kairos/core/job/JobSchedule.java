package io.kairos.core.job;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.time.Instant;

/**
 * Trigger rule of a job. Persisted with a {@code kind} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = JobSchedule.Every.class, name = "every"),
    @JsonSubTypes.Type(value = JobSchedule.Cron.class, name = "cron"),
    @JsonSubTypes.Type(value = JobSchedule.At.class, name = "at")
})
public interface JobSchedule {

    default boolean oneShot() {
        return false;
    }

    /**
     * Human readable summary used by the CLI and logs.
     */
    String describe();

    static Every every(long intervalMs) {
        return new Every(intervalMs);
    }

    static Cron cron(String expr, String tz) {
        return new Cron(expr, tz);
    }

    static At at(long timestampMs) {
        return new At(timestampMs);
    }

    record Every(long intervalMs) implements JobSchedule {
        @Override
        public String describe() {
            if (intervalMs % 1000 == 0) {
                return "every " + intervalMs / 1000 + "s";
            }
            return "every " + intervalMs + "ms";
        }
    }

    record Cron(String expr, String tz) implements JobSchedule {
        public Cron {
            expr = expr == null ? null : expr.trim();
            tz = tz == null || tz.isBlank() ? null : tz.trim();
        }

        @Override
        public String describe() {
            return tz == null ? "cron '" + expr + "'" : "cron '" + expr + "' (" + tz + ")";
        }
    }

    record At(long timestampMs) implements JobSchedule {
        @Override
        public boolean oneShot() {
            return true;
        }

        @Override
        public String describe() {
            return "once at " + Instant.ofEpochMilli(timestampMs);
        }
    }
}

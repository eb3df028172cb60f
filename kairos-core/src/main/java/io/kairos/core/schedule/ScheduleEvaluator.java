package io.kairos.core.schedule;

import io.kairos.core.job.JobSchedule;
import io.kairos.core.job.JobValidationException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pure next-fire computation for the three schedule kinds.
 *
 * <p>Interval schedules skip ticks missed during downtime instead of backfilling them. Cron
 * schedules are interpreted in their own zone or the evaluator's default zone. One-shot schedules
 * return nothing once their instant has passed.
 */
public final class ScheduleEvaluator {
    private final ZoneId defaultZone;
    private final Map<String, CronExpression> parsed = new ConcurrentHashMap<>();

    public ScheduleEvaluator(ZoneId defaultZone) {
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
    }

    public ZoneId defaultZone() {
        return defaultZone;
    }

    /**
     * @param anchorMs the job's creation time, used by interval schedules that never fired
     * @return the next trigger time in epoch millis, or {@code null} when the schedule will not fire again
     */
    public Long nextFire(JobSchedule schedule, long nowMs, Long lastFireMs, long anchorMs) {
        if (schedule instanceof JobSchedule.Every every) {
            return nextInterval(every, nowMs, lastFireMs, anchorMs);
        }
        if (schedule instanceof JobSchedule.Cron cron) {
            return nextCron(cron, nowMs);
        }
        if (schedule instanceof JobSchedule.At at) {
            // Only a run started at or after the instant consumes it; an early forced run does not.
            if (lastFireMs != null && lastFireMs >= at.timestampMs()) {
                return null;
            }
            return at.timestampMs() >= nowMs ? at.timestampMs() : null;
        }
        throw new InvalidScheduleException("unsupported schedule: " + schedule);
    }

    /**
     * Rejects schedules that are malformed or can never fire from {@code nowMs} on.
     */
    public void validate(JobSchedule schedule, long nowMs) {
        if (schedule == null) {
            throw new JobValidationException("schedule is required");
        }
        if (schedule instanceof JobSchedule.Every every) {
            if (every.intervalMs() <= 0) {
                throw new JobValidationException("interval must be > 0 ms, got " + every.intervalMs());
            }
            try {
                Math.addExact(nowMs, every.intervalMs());
            } catch (ArithmeticException e) {
                throw new JobValidationException("interval is too large: " + every.intervalMs() + " ms");
            }
            return;
        }
        if (schedule instanceof JobSchedule.Cron cron) {
            if (nextCron(cron, nowMs) == null) {
                throw new InvalidScheduleException("cron expression never fires: " + cron.expr());
            }
            return;
        }
        if (schedule instanceof JobSchedule.At at) {
            if (at.timestampMs() < nowMs) {
                throw new JobValidationException(
                    "one-shot timestamp is in the past: " + Instant.ofEpochMilli(at.timestampMs())
                );
            }
            return;
        }
        throw new InvalidScheduleException("unsupported schedule: " + schedule);
    }

    public ZoneId zoneOf(JobSchedule.Cron cron) {
        if (cron.tz() == null) {
            return defaultZone;
        }
        try {
            return ZoneId.of(cron.tz());
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("unknown timezone: " + cron.tz(), e);
        }
    }

    private Long nextInterval(JobSchedule.Every every, long nowMs, Long lastFireMs, long anchorMs) {
        long interval = every.intervalMs();
        if (interval <= 0) {
            throw new InvalidScheduleException("interval must be > 0 ms, got " + interval);
        }
        try {
            long candidate = Math.addExact(lastFireMs != null ? lastFireMs : anchorMs, interval);
            if (candidate <= nowMs) {
                long missed = (nowMs - candidate) / interval + 1;
                candidate = Math.addExact(candidate, Math.multiplyExact(missed, interval));
            }
            return candidate;
        } catch (ArithmeticException e) {
            throw new InvalidScheduleException("interval overflows epoch millis: " + interval + " ms", e);
        }
    }

    private Long nextCron(JobSchedule.Cron cron, long nowMs) {
        if (cron.expr() == null || cron.expr().isBlank()) {
            throw new InvalidScheduleException("cron expression is required");
        }
        CronExpression expression = parsed.computeIfAbsent(cron.expr(), CronExpression::parse);
        ZoneId zone = zoneOf(cron);
        return expression.next(Instant.ofEpochMilli(nowMs).atZone(zone))
            .map(next -> next.toInstant().toEpochMilli())
            .orElse(null);
    }
}

package io.kairos.core.registry;

import io.kairos.core.bus.JobEvent;
import io.kairos.core.bus.JobEventBus;
import io.kairos.core.bus.JobEventType;
import io.kairos.core.channel.ChannelKind;
import io.kairos.core.job.Job;
import io.kairos.core.job.JobNotFoundException;
import io.kairos.core.job.JobPayload;
import io.kairos.core.job.JobSchedule;
import io.kairos.core.job.JobState;
import io.kairos.core.job.JobValidationException;
import io.kairos.core.schedule.ScheduleEvaluator;
import io.kairos.core.scheduler.JobScheduler;
import io.kairos.core.store.JobCatalog;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link JobRegistry} over the job catalog. Mutations wake the scheduler loop.
 */
public final class JobService implements JobRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(JobService.class);
    private static final Comparator<Job> CREATION_ORDER = Comparator
        .comparingLong(Job::createdAtMs)
        .thenComparing(Job::id);

    private final JobCatalog catalog;
    private final ScheduleEvaluator evaluator;
    private final JobScheduler scheduler;
    private final JobEventBus events;
    private final Clock clock;

    public JobService(
        JobCatalog catalog,
        ScheduleEvaluator evaluator,
        JobScheduler scheduler,
        JobEventBus events,
        Clock clock
    ) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Job addJob(String name, JobSchedule schedule, JobPayload payload) {
        if (name == null || name.isBlank()) {
            throw new JobValidationException("name is required");
        }
        JobPayload normalized = validatePayload(payload);
        long now = clock.millis();
        evaluator.validate(schedule, now);

        Long next = evaluator.nextFire(schedule, now, null, now);
        Job job = new Job(
            UUID.randomUUID().toString(),
            name.trim(),
            schedule,
            normalized,
            JobState.scheduled(next),
            now,
            now
        );
        catalog.write(working -> working.add(job));
        LOG.info("Added job {} ({}) {}, next run {}", job.name(), job.id(), schedule.describe(), describeTime(next));
        publish(JobEventType.ADDED, job, schedule.describe());
        scheduler.wake();
        return job;
    }

    @Override
    public List<Job> listJobs(boolean includeDisabled) {
        return catalog.read(jobs -> jobs.stream()
            .filter(job -> includeDisabled || job.enabled())
            .sorted(CREATION_ORDER)
            .toList());
    }

    @Override
    public Job getJob(String id) {
        return catalog.find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Override
    public Job enableJob(String id, boolean enabled) {
        Job existing = getJob(id);
        if (existing.enabled() == enabled) {
            return existing;
        }
        Job updated = catalog.write(working -> {
            int index = indexOf(working, id);
            Job current = working.get(index);
            if (current.enabled() == enabled) {
                return current;
            }
            long now = clock.millis();
            Long next = null;
            if (enabled) {
                next = evaluator.nextFire(current.schedule(), now, current.state().lastRunAtMs(), current.createdAtMs());
                if (next == null && current.schedule().oneShot()) {
                    throw new JobValidationException("one-shot job " + id + " has already fired or its time has passed");
                }
            }
            Job changed = current.withState(current.state().withEnabled(enabled, next), now);
            working.set(index, changed);
            return changed;
        });
        LOG.info("Job {} ({}) {}", updated.name(), updated.id(), enabled ? "enabled" : "disabled");
        publish(enabled ? JobEventType.ENABLED : JobEventType.DISABLED, updated, "");
        if (enabled) {
            scheduler.wake();
        }
        return updated;
    }

    @Override
    public void removeJob(String id) {
        Job removed = catalog.write(working -> working.remove(indexOf(working, id)));
        LOG.info("Removed job {} ({})", removed.name(), removed.id());
        publish(JobEventType.REMOVED, removed, "");
        scheduler.wake();
    }

    @Override
    public boolean runJob(String id, boolean force) throws InterruptedException {
        return scheduler.runNow(id, force);
    }

    private JobPayload validatePayload(JobPayload payload) {
        if (payload == null || payload.message() == null || payload.message().isBlank()) {
            throw new JobValidationException("message is required");
        }
        if (!payload.deliver()) {
            return payload;
        }
        if (payload.channel() == null) {
            throw new JobValidationException("channel is required when deliver is set");
        }
        if (payload.recipient() == null) {
            throw new JobValidationException("recipient is required when deliver is set");
        }
        ChannelKind kind = ChannelKind.fromId(payload.channel())
            .orElseThrow(() -> new JobValidationException("unknown channel: " + payload.channel()));
        return new JobPayload(payload.message(), true, kind.id(), payload.recipient());
    }

    private void publish(JobEventType type, Job job, String detail) {
        events.publish(new JobEvent(type, job.id(), job.name(), clock.instant(), detail));
    }

    private static int indexOf(List<Job> jobs, String id) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).id().equals(id)) {
                return i;
            }
        }
        throw new JobNotFoundException(id);
    }

    private static String describeTime(Long epochMs) {
        return epochMs == null ? "none" : Instant.ofEpochMilli(epochMs).toString();
    }
}

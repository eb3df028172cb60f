package io.kairos.core.scheduler;

import io.kairos.core.job.Job;
import io.kairos.core.job.JobNotFoundException;
import io.kairos.core.job.JobState;
import io.kairos.core.job.KairosException;
import io.kairos.core.schedule.ScheduleEvaluator;
import io.kairos.core.store.JobCatalog;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The scheduler loop: one coordinating thread that sleeps until the earliest due job, claims due
 * jobs and hands them to a bounded worker pool.
 *
 * <p>A job id in the in-flight set is the per-job execution lock; it is claimed under the catalog
 * lock, so a job disabled or removed before the claim is never dispatched. Results are written back
 * through the catalog against the job's current record.
 */
public final class JobScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobScheduler.class);
    static final Duration MAX_IDLE_WAIT = Duration.ofSeconds(60);
    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(5);

    private final JobCatalog catalog;
    private final ScheduleEvaluator evaluator;
    private final JobExecutor executor;
    private final Clock clock;
    private final Duration shutdownGrace;
    private final ExecutorService workers;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final List<SchedulerListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock waitLock = new ReentrantLock();
    private final Condition wakeup = waitLock.newCondition();
    private boolean wakeRequested;

    private volatile boolean running;
    private Thread loopThread;

    public JobScheduler(
        JobCatalog catalog,
        ScheduleEvaluator evaluator,
        JobExecutor executor,
        Clock clock,
        int maxConcurrentJobs,
        Duration shutdownGrace
    ) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace must not be null");
        this.workers = Executors.newFixedThreadPool(
            Math.max(1, maxConcurrentJobs),
            JobExecutor.daemonThreads("kairos-worker-")
        );
    }

    public JobScheduler addListener(SchedulerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
        return this;
    }

    /**
     * Recovers the persisted jobs and starts the loop thread.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        int recomputed = recover();
        LOG.info("Scheduler starting; recomputed next run of {} recurring job(s)", recomputed);
        running = true;
        loopThread = new Thread(this::loop, "kairos-scheduler");
        loopThread.setDaemon(true);
        loopThread.start();
    }

    public boolean isRunning() {
        return running;
    }

    public Set<String> inFlight() {
        return Set.copyOf(inFlight);
    }

    public void wake() {
        waitLock.lock();
        try {
            wakeRequested = true;
            wakeup.signalAll();
        } finally {
            waitLock.unlock();
        }
    }

    /**
     * Recomputes the next run of enabled recurring jobs from the current time, skipping ticks missed
     * while the process was down. One-shot jobs keep their stored next run so an overdue one fires once.
     */
    int recover() {
        return catalog.write(working -> {
            long now = clock.millis();
            int changed = 0;
            for (int i = 0; i < working.size(); i++) {
                Job job = working.get(i);
                if (!job.enabled() || job.schedule().oneShot()) {
                    continue;
                }
                Long next = nextFire(job, now, job.state().lastRunAtMs());
                if (!Objects.equals(next, job.state().nextRunAtMs())) {
                    working.set(i, job.withState(job.state().withNextRun(next), now));
                    changed++;
                }
            }
            return changed;
        });
    }

    /**
     * Claims every due job that is not already running and submits it to the worker pool.
     */
    public List<CompletableFuture<ExecutionResult>> tick() {
        if (workers.isShutdown()) {
            return List.of();
        }
        long now = clock.millis();
        List<Job> claimed = catalog.read(jobs -> {
            List<Job> due = new ArrayList<>();
            for (Job job : jobs) {
                if (job.isDue(now) && inFlight.add(job.id())) {
                    due.add(job);
                }
            }
            return due;
        });
        List<CompletableFuture<ExecutionResult>> futures = new ArrayList<>(claimed.size());
        for (Job job : claimed) {
            futures.add(dispatch(job, false));
        }
        return futures;
    }

    /**
     * Runs a job now and waits for it.
     *
     * @param force run even when the job is disabled; the next run of a recurring job is left as is
     * @return {@code true} if the job ran and succeeded; {@code false} if it was skipped or failed
     */
    public boolean runNow(String id, boolean force) throws InterruptedException {
        Optional<Job> claimed = catalog.read(jobs -> {
            Job job = jobs.stream()
                .filter(candidate -> candidate.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new JobNotFoundException(id));
            if (!force && !job.enabled()) {
                return Optional.<Job>empty();
            }
            return inFlight.add(id) ? Optional.of(job) : Optional.<Job>empty();
        });
        if (claimed.isEmpty()) {
            LOG.info("Skipped manual run of job {}: disabled or already running", id);
            return false;
        }

        try {
            return dispatch(claimed.get(), force).get().succeeded();
        } catch (CancellationException e) {
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof KairosException kairos) {
                throw kairos;
            }
            throw new KairosException("manual run of job " + id + " failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Stops dispatching, waits up to the shutdown grace for running jobs, then abandons them without
     * recording their completion.
     */
    @Override
    public void close() {
        synchronized (this) {
            running = false;
        }
        wake();
        workers.shutdown();
        try {
            if (loopThread != null) {
                loopThread.join(shutdownGrace.toMillis() + 1_000);
            }
            if (!workers.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Abandoning {} running job(s) after {}: {}", inFlight.size(), shutdownGrace, inFlight);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Scheduler stopped");
    }

    private void loop() {
        while (running) {
            Duration wait;
            try {
                tick();
                wait = untilNextDue();
            } catch (RuntimeException e) {
                LOG.error("Scheduler tick failed; retrying in {}", ERROR_BACKOFF, e);
                wait = ERROR_BACKOFF;
            }
            try {
                await(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private Duration untilNextDue() {
        long now = clock.millis();
        Long earliest = catalog.read(jobs -> jobs.stream()
            .filter(Job::enabled)
            .filter(job -> !inFlight.contains(job.id()))
            .map(job -> job.state().nextRunAtMs())
            .filter(Objects::nonNull)
            .min(Long::compare)
            .orElse(null));
        if (earliest == null) {
            return MAX_IDLE_WAIT;
        }
        long delay = Math.max(0, earliest - now);
        return Duration.ofMillis(Math.min(delay, MAX_IDLE_WAIT.toMillis()));
    }

    private void await(Duration wait) throws InterruptedException {
        waitLock.lock();
        try {
            long remaining = wait.toNanos();
            while (!wakeRequested && running && remaining > 0) {
                remaining = wakeup.awaitNanos(remaining);
            }
            wakeRequested = false;
        } finally {
            waitLock.unlock();
        }
    }

    private CompletableFuture<ExecutionResult> dispatch(Job job, boolean forced) {
        CompletableFuture<ExecutionResult> future = new CompletableFuture<>();
        try {
            workers.execute(() -> run(job, forced, future));
        } catch (RejectedExecutionException e) {
            inFlight.remove(job.id());
            future.cancel(false);
        }
        return future;
    }

    private void run(Job job, boolean forced, CompletableFuture<ExecutionResult> future) {
        try {
            LOG.info("Running job {} ({}){}", job.name(), job.id(), forced ? " [forced]" : "");
            listeners.forEach(listener -> notifyStarted(listener, job, forced));
            ExecutionResult result = executor.execute(job);
            complete(result, forced);
            LOG.info(
                "Job {} ({}) finished with {} in {} ms",
                job.name(), job.id(), result.status(), result.durationMs()
            );
            listeners.forEach(listener -> notifyFinished(listener, job, result, forced));
            future.complete(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Abandoned job {} ({}) during shutdown", job.name(), job.id());
            future.cancel(false);
        } catch (RuntimeException e) {
            LOG.error("Failed to record the result of job {} ({})", job.name(), job.id(), e);
            future.completeExceptionally(e);
        } finally {
            inFlight.remove(job.id());
            wake();
        }
    }

    private void complete(ExecutionResult result, boolean forced) {
        catalog.write(working -> {
            long now = clock.millis();
            int index = indexOf(working, result.jobId());
            if (index < 0) {
                LOG.info("Job {} was removed while running; dropping its result", result.jobId());
                return null;
            }
            Job current = working.get(index);
            JobState state = current.state().withOutcome(
                result.startedAtMs(),
                result.status(),
                result.error(),
                result.deliveryStatus(),
                result.durationMs()
            );
            if (current.schedule().oneShot()) {
                Long pending = state.nextRunAtMs();
                boolean stillPending = forced && pending != null && pending > result.startedAtMs();
                if (!stillPending) {
                    state = state.withEnabled(false, null);
                }
            } else if (!forced) {
                state = state.withNextRun(state.enabled() ? nextFire(current, now, result.startedAtMs()) : null);
            }
            working.set(index, current.withState(state, now));
            return null;
        });
    }

    private Long nextFire(Job job, long now, Long lastFire) {
        try {
            return evaluator.nextFire(job.schedule(), now, lastFire, job.createdAtMs());
        } catch (KairosException e) {
            LOG.warn("Job {} ({}) has an unusable schedule and will not run again: {}", job.name(), job.id(), e.getMessage());
            return null;
        }
    }

    private static int indexOf(List<Job> jobs, String id) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private void notifyStarted(SchedulerListener listener, Job job, boolean forced) {
        try {
            listener.onStarted(job, forced);
        } catch (RuntimeException e) {
            LOG.warn("Scheduler listener failed on start of job {}", job.id(), e);
        }
    }

    private void notifyFinished(SchedulerListener listener, Job job, ExecutionResult result, boolean forced) {
        try {
            listener.onFinished(job, result, forced);
        } catch (RuntimeException e) {
            LOG.warn("Scheduler listener failed on completion of job {}", job.id(), e);
        }
    }
}

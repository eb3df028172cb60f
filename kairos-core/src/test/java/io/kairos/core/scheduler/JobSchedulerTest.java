package io.kairos.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kairos.core.bus.JobEventBus;
import io.kairos.core.job.DeliveryStatus;
import io.kairos.core.job.Job;
import io.kairos.core.job.JobNotFoundException;
import io.kairos.core.job.JobPayload;
import io.kairos.core.job.JobSchedule;
import io.kairos.core.job.JobState;
import io.kairos.core.job.JobStatus;
import io.kairos.core.registry.JobService;
import io.kairos.core.schedule.ScheduleEvaluator;
import io.kairos.core.store.FileJobStore;
import io.kairos.core.store.JobCatalog;
import io.kairos.core.support.MutableClock;
import io.kairos.core.support.RecordingChannelSender;
import io.kairos.core.support.ScriptedAgentClient;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobSchedulerTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(0);
    private final ScriptedAgentClient agent = new ScriptedAgentClient();
    private final RecordingChannelSender channels = new RecordingChannelSender();
    private JobCatalog catalog;
    private JobExecutor executor;
    private JobScheduler scheduler;
    private JobService service;

    @BeforeEach
    void setUp() {
        catalog = new JobCatalog(new FileJobStore(tempDir.resolve("jobs.json")), Duration.ofSeconds(5));
        ScheduleEvaluator evaluator = new ScheduleEvaluator(ZoneOffset.UTC);
        executor = new JobExecutor(agent, channels, Duration.ofSeconds(5), Duration.ofSeconds(5), clock, 4);
        scheduler = new JobScheduler(catalog, evaluator, executor, clock, 2, Duration.ofMillis(200));
        service = new JobService(catalog, evaluator, scheduler, JobEventBus.NOOP, clock);
    }

    @AfterEach
    void tearDown() {
        agent.release();
        scheduler.close();
        executor.close();
    }

    private static List<ExecutionResult> await(List<CompletableFuture<ExecutionResult>> futures) {
        return futures.stream().map(future -> future.orTimeout(10, TimeUnit.SECONDS).join()).toList();
    }

    @Test
    void shouldRunIntervalJobAndScheduleNextTick() {
        Job job = service.addJob("ping", JobSchedule.every(60_000), JobPayload.message("hello"));
        assertThat(job.state().nextRunAtMs()).isEqualTo(60_000L);

        assertThat(scheduler.tick()).isEmpty();
        clock.set(60_000);
        List<ExecutionResult> results = await(scheduler.tick());

        assertThat(results).singleElement().satisfies(result -> assertThat(result.response()).isEqualTo("echo: hello"));
        JobState state = service.getJob(job.id()).state();
        assertThat(state.lastStatus()).isEqualTo(JobStatus.SUCCESS);
        assertThat(state.lastRunAtMs()).isEqualTo(60_000L);
        assertThat(state.nextRunAtMs()).isEqualTo(120_000L);
    }

    @Test
    void shouldFireOneShotOnceWithDeliveryThenDisableIt() {
        clock.set(1_000_000);
        Job job = service.addJob("once", JobSchedule.at(1_005_000), JobPayload.delivered("remind", "telegram", "42"));

        clock.set(1_005_000);
        await(scheduler.tick());
        clock.set(1_010_000);
        List<CompletableFuture<ExecutionResult>> second = scheduler.tick();

        assertThat(second).isEmpty();
        assertThat(channels.deliveries())
            .containsExactly(new RecordingChannelSender.Delivery("telegram", "42", "echo: remind"));
        JobState state = service.getJob(job.id()).state();
        assertThat(state.enabled()).isFalse();
        assertThat(state.nextRunAtMs()).isNull();
        assertThat(state.lastDeliveryStatus()).isEqualTo(DeliveryStatus.DELIVERED);
    }

    @Test
    void shouldRunDisabledJobOnlyWhenForced() throws Exception {
        Job job = service.addJob("ping", JobSchedule.every(60_000), JobPayload.message("hello"));
        service.enableJob(job.id(), false);
        clock.set(60_000);

        assertThat(scheduler.tick()).isEmpty();
        assertThat(scheduler.runNow(job.id(), false)).isFalse();
        assertThat(scheduler.runNow(job.id(), true)).isTrue();

        Job after = service.getJob(job.id());
        assertThat(after.enabled()).isFalse();
        assertThat(after.state().nextRunAtMs()).isNull();
        assertThat(after.state().lastStatus()).isEqualTo(JobStatus.SUCCESS);
        assertThat(agent.messages()).containsExactly("hello");
    }

    @Test
    void shouldNotMoveNextRunOfRecurringJobOnForcedRun() throws Exception {
        Job job = service.addJob("ping", JobSchedule.every(60_000), JobPayload.message("hello"));
        clock.set(10_000);

        assertThat(scheduler.runNow(job.id(), true)).isTrue();

        JobState state = service.getJob(job.id()).state();
        assertThat(state.nextRunAtMs()).isEqualTo(60_000L);
        assertThat(state.lastRunAtMs()).isEqualTo(10_000L);
    }

    @Test
    void shouldKeepPendingOneShotAfterEarlyForcedRun() throws Exception {
        Job job = service.addJob("once", JobSchedule.at(50_000), JobPayload.message("hello"));

        assertThat(scheduler.runNow(job.id(), true)).isTrue();

        JobState state = service.getJob(job.id()).state();
        assertThat(state.enabled()).isTrue();
        assertThat(state.nextRunAtMs()).isEqualTo(50_000L);
    }

    @Test
    void shouldNeverRunSameJobConcurrently() throws Exception {
        Job job = service.addJob("slow", JobSchedule.every(1_000), JobPayload.message("block until released"));
        clock.set(1_000);
        List<CompletableFuture<ExecutionResult>> first = scheduler.tick();
        assertThat(agent.blocked().await(5, TimeUnit.SECONDS)).isTrue();

        clock.set(5_000);
        assertThat(scheduler.tick()).isEmpty();
        assertThat(scheduler.runNow(job.id(), true)).isFalse();
        assertThat(scheduler.inFlight()).containsExactly(job.id());

        agent.release();
        await(first);
        assertThat(agent.messages()).hasSize(1);
        assertThat(scheduler.inFlight()).isEmpty();
    }

    @Test
    void shouldIsolateFailingJobFromOthers() {
        Job failing = service.addJob("broken", JobSchedule.every(1_000), JobPayload.message("fail hard"));
        Job healthy = service.addJob("fine", JobSchedule.every(1_000), JobPayload.message("hello"));
        clock.set(1_000);

        List<ExecutionResult> results = await(scheduler.tick());

        assertThat(results).hasSize(2);
        JobState broken = service.getJob(failing.id()).state();
        assertThat(broken.lastStatus()).isEqualTo(JobStatus.FAILURE);
        assertThat(broken.lastError()).isEqualTo("agent refused: fail hard");
        assertThat(broken.nextRunAtMs()).isEqualTo(2_000L);
        assertThat(service.getJob(healthy.id()).state().lastStatus()).isEqualTo(JobStatus.SUCCESS);
    }

    @Test
    void shouldKeepSuccessAndRecordDeliveryFailure() {
        channels.failWith(true);
        Job job = service.addJob("report", JobSchedule.every(1_000), JobPayload.delivered("hello", "telegram", "42"));
        clock.set(1_000);

        await(scheduler.tick());

        JobState state = service.getJob(job.id()).state();
        assertThat(state.lastStatus()).isEqualTo(JobStatus.SUCCESS);
        assertThat(state.lastDeliveryStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(state.lastError()).isEqualTo("delivery to telegram:42 failed: telegram is down");
    }

    @Test
    void shouldDropResultOfJobRemovedWhileRunning() throws Exception {
        Job job = service.addJob("slow", JobSchedule.every(1_000), JobPayload.message("block until released"));
        clock.set(1_000);
        List<CompletableFuture<ExecutionResult>> running = scheduler.tick();
        assertThat(agent.blocked().await(5, TimeUnit.SECONDS)).isTrue();

        service.removeJob(job.id());
        agent.release();
        await(running);

        assertThat(service.listJobs(true)).isEmpty();
    }

    @Test
    void shouldKeepJobDisabledWhenDisabledWhileRunning() throws Exception {
        Job job = service.addJob("slow", JobSchedule.every(1_000), JobPayload.message("block until released"));
        clock.set(1_000);
        List<CompletableFuture<ExecutionResult>> running = scheduler.tick();
        assertThat(agent.blocked().await(5, TimeUnit.SECONDS)).isTrue();

        service.enableJob(job.id(), false);
        agent.release();
        await(running);

        JobState state = service.getJob(job.id()).state();
        assertThat(state.enabled()).isFalse();
        assertThat(state.nextRunAtMs()).isNull();
        assertThat(state.lastStatus()).isEqualTo(JobStatus.SUCCESS);
    }

    @Test
    void shouldSkipMissedTicksOnRecoveryButFireOverdueOneShotOnce() {
        Job interval = service.addJob("ping", JobSchedule.every(60_000), JobPayload.message("hello"));
        Job once = service.addJob("once", JobSchedule.at(30_000), JobPayload.message("remind"));

        clock.set(250_000);
        assertThat(scheduler.recover()).isEqualTo(1);

        assertThat(service.getJob(interval.id()).state().nextRunAtMs()).isEqualTo(300_000L);
        assertThat(service.getJob(once.id()).state().nextRunAtMs()).isEqualTo(30_000L);
        List<ExecutionResult> results = await(scheduler.tick());
        assertThat(results).extracting(ExecutionResult::jobId).containsExactly(once.id());
        assertThat(service.getJob(once.id()).enabled()).isFalse();
    }

    @Test
    void shouldRejectManualRunOfUnknownJob() {
        assertThatThrownBy(() -> scheduler.runNow("missing", true))
            .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void shouldAbandonRunningJobsAfterShutdownGrace() throws Exception {
        Job job = service.addJob("slow", JobSchedule.every(1_000), JobPayload.message("block until released"));
        clock.set(1_000);
        List<CompletableFuture<ExecutionResult>> running = scheduler.tick();
        assertThat(agent.blocked().await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.close();

        assertThatThrownBy(() -> running.get(0).get(5, TimeUnit.SECONDS))
            .isInstanceOf(CancellationException.class);
        assertThat(service.getJob(job.id()).state().lastRunAtMs()).isNull();
        assertThat(scheduler.tick()).isEmpty();
    }

    @Test
    void shouldDispatchDueJobsFromBackgroundLoop() throws Exception {
        Job job = service.addJob("ping", JobSchedule.every(60_000), JobPayload.message("hello"));
        CompletableFuture<ExecutionResult> finished = new CompletableFuture<>();
        scheduler.addListener((ran, result, forced) -> finished.complete(result));
        scheduler.start();

        clock.set(60_000);
        scheduler.wake();

        ExecutionResult result = finished.get(10, TimeUnit.SECONDS);
        assertThat(result.jobId()).isEqualTo(job.id());
        assertThat(result.status()).isEqualTo(JobStatus.SUCCESS);
    }
}

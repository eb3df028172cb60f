package io.kairos.core.scheduler;

import io.kairos.core.agent.AgentClient;
import io.kairos.core.agent.AgentException;
import io.kairos.core.agent.AgentSession;
import io.kairos.core.channel.ChannelSender;
import io.kairos.core.channel.DeliveryException;
import io.kairos.core.job.DeliveryStatus;
import io.kairos.core.job.Job;
import io.kairos.core.job.JobPayload;
import io.kairos.core.job.JobStatus;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one job: the agent call, then the optional channel delivery.
 *
 * <p>Both calls go through a separate I/O pool so that a call exceeding its timeout is abandoned
 * (and interrupted) instead of holding the worker. Failures are captured in the
 * {@link ExecutionResult}; nothing but {@link InterruptedException} escapes.
 */
public final class JobExecutor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobExecutor.class);

    private final AgentClient agent;
    private final ChannelSender channels;
    private final Duration agentTimeout;
    private final Duration deliveryTimeout;
    private final Clock clock;
    private final ExecutorService io;

    public JobExecutor(
        AgentClient agent,
        ChannelSender channels,
        Duration agentTimeout,
        Duration deliveryTimeout,
        Clock clock,
        int ioThreads
    ) {
        this.agent = Objects.requireNonNull(agent, "agent must not be null");
        this.channels = Objects.requireNonNull(channels, "channels must not be null");
        this.agentTimeout = Objects.requireNonNull(agentTimeout, "agentTimeout must not be null");
        this.deliveryTimeout = Objects.requireNonNull(deliveryTimeout, "deliveryTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.io = Executors.newFixedThreadPool(Math.max(1, ioThreads), daemonThreads("kairos-io-"));
    }

    public ExecutionResult execute(Job job) throws InterruptedException {
        JobPayload payload = job.payload();
        long startedAt = clock.millis();

        String response;
        try {
            response = call(() -> agent.submit(payload.message(), AgentSession.forJob(job), agentTimeout), agentTimeout);
        } catch (ExecutionException e) {
            String error = describe(e.getCause());
            LOG.warn("Job {} ({}) failed: {}", job.name(), job.id(), error);
            return new ExecutionResult(job.id(), job.name(), startedAt, clock.millis(), JobStatus.FAILURE, null, error, null, null);
        } catch (TimeoutException e) {
            String error = "agent " + agent.name() + " timed out after " + human(agentTimeout);
            LOG.warn("Job {} ({}) failed: {}", job.name(), job.id(), error);
            return new ExecutionResult(job.id(), job.name(), startedAt, clock.millis(), JobStatus.FAILURE, null, error, null, null);
        }

        if (!payload.deliver()) {
            return new ExecutionResult(job.id(), job.name(), startedAt, clock.millis(), JobStatus.SUCCESS, response, null, null, null);
        }

        String target = payload.channel() + ":" + payload.recipient();
        String deliveryError = null;
        try {
            call(() -> {
                channels.send(payload.channel(), payload.recipient(), response, deliveryTimeout);
                return null;
            }, deliveryTimeout);
        } catch (ExecutionException e) {
            deliveryError = describe(e.getCause());
        } catch (TimeoutException e) {
            deliveryError = "timed out after " + human(deliveryTimeout);
        }

        if (deliveryError == null) {
            LOG.debug("Delivered job {} response to {}", job.id(), target);
            return new ExecutionResult(
                job.id(), job.name(), startedAt, clock.millis(), JobStatus.SUCCESS, response, null, DeliveryStatus.DELIVERED, null
            );
        }
        String error = "delivery to " + target + " failed: " + deliveryError;
        LOG.warn("Job {} ({}): {}", job.name(), job.id(), error);
        return new ExecutionResult(
            job.id(), job.name(), startedAt, clock.millis(), JobStatus.SUCCESS, response, error, DeliveryStatus.FAILED, deliveryError
        );
    }

    @Override
    public void close() {
        io.shutdownNow();
    }

    private <T> T call(Callable<T> task, Duration timeout) throws ExecutionException, TimeoutException, InterruptedException {
        Future<T> future = io.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static String describe(Throwable error) {
        if (error instanceof AgentException || error instanceof DeliveryException) {
            return error.getMessage();
        }
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private static String human(Duration duration) {
        long millis = duration.toMillis();
        return millis % 1000 == 0 ? millis / 1000 + "s" : millis + "ms";
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

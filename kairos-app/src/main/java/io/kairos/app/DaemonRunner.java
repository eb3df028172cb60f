package io.kairos.app;

import io.kairos.core.api.JobsGatewayServer;
import io.kairos.core.bus.JobEvent;
import io.kairos.core.config.ConfigService;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.runtime.KairosRuntime;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the scheduler loop and the gateway until the process is asked to stop.
 */
final class DaemonRunner {
    private static final Logger LOG = LoggerFactory.getLogger(DaemonRunner.class);
    private static final Duration FOLLOW_POLL = Duration.ofSeconds(1);

    private final ConfigService configService;
    private final Path configPath;
    private final Clock clock;

    DaemonRunner(ConfigService configService, Path configPath, Clock clock) {
        this.configService = configService;
        this.configPath = configPath;
        this.clock = clock;
    }

    int run(Integer portOverride, boolean follow) throws Exception {
        KairosConfig config = configService.load(configPath);
        int port = portOverride != null ? portOverride : config.gateway().port();

        CountDownLatch shutdown = new CountDownLatch(1);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            shutdown.countDown();
            awaitQuietly(stopped, config.scheduler().shutdownGrace().plusSeconds(5));
        }, "kairos-shutdown"));

        try (KairosRuntime runtime = KairosRuntime.fromConfig(config, clock);
             JobsGatewayServer gateway = new JobsGatewayServer(
                 port,
                 config.gateway().host(),
                 runtime.service(),
                 runtime.history(),
                 runtime.events()
             )) {
            runtime.start();
            gateway.start();
            System.out.println("Kairos scheduler running, store " + runtime.storePath());
            System.out.println("Gateway started on http://" + config.gateway().host() + ":" + gateway.port());
            if (follow) {
                while (!shutdown.await(0, TimeUnit.MILLISECONDS)) {
                    Optional<JobEvent> event = runtime.events().poll(FOLLOW_POLL);
                    event.ifPresent(value -> System.out.println(value.describe()));
                }
            } else {
                shutdown.await();
            }
            LOG.info("Shutting down");
        } finally {
            stopped.countDown();
        }
        return 0;
    }

    private static void awaitQuietly(CountDownLatch latch, Duration timeout) {
        try {
            if (!latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Daemon did not stop within {}", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

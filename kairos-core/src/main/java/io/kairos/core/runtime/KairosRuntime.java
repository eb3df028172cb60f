package io.kairos.core.runtime;

import io.kairos.core.agent.AgentClient;
import io.kairos.core.agent.DisabledAgentClient;
import io.kairos.core.agent.OpenAiCompatAgentClient;
import io.kairos.core.bus.BoundedJobEventBus;
import io.kairos.core.bus.JobEventListener;
import io.kairos.core.channel.ChannelKind;
import io.kairos.core.channel.ChannelRegistry;
import io.kairos.core.channel.ChannelSender;
import io.kairos.core.channel.SlackChannelSender;
import io.kairos.core.channel.TelegramChannelSender;
import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.ConfigService;
import io.kairos.core.config.model.AgentConfig;
import io.kairos.core.config.model.ChannelConfig;
import io.kairos.core.config.model.ChannelsConfig;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.config.model.SchedulerConfig;
import io.kairos.core.observability.ExecutionHistory;
import io.kairos.core.registry.JobService;
import io.kairos.core.schedule.ScheduleEvaluator;
import io.kairos.core.scheduler.JobExecutor;
import io.kairos.core.scheduler.JobScheduler;
import io.kairos.core.store.FileJobStore;
import io.kairos.core.store.JobCatalog;
import io.kairos.core.store.JobStoreLock;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One wired scheduler instance: store, loop, executor, registry and the in-memory observers.
 * The loop only runs after {@link #start()}; without it the registry still serves manual runs.
 *
 * <p>The runtime owns its store exclusively until {@link #close()}; creating a second runtime on
 * the same store fails with {@link io.kairos.core.store.JobStoreLockedException}.
 */
public final class KairosRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(KairosRuntime.class);

    private final FileJobStore store;
    private final JobStoreLock lock;
    private final JobExecutor executor;
    private final JobScheduler scheduler;
    private final JobService service;
    private final ExecutionHistory history;
    private final BoundedJobEventBus events;

    private KairosRuntime(
        FileJobStore store,
        JobStoreLock lock,
        JobExecutor executor,
        JobScheduler scheduler,
        JobService service,
        ExecutionHistory history,
        BoundedJobEventBus events
    ) {
        this.store = store;
        this.lock = lock;
        this.executor = executor;
        this.scheduler = scheduler;
        this.service = service;
        this.history = history;
        this.events = events;
    }

    public static KairosRuntime fromConfig(KairosConfig config, Clock clock) {
        return create(config, clock, buildAgent(config.agent()), buildChannels(config.channels()));
    }

    public static KairosRuntime create(KairosConfig config, Clock clock, AgentClient agent, ChannelSender channels) {
        SchedulerConfig settings = config.scheduler();
        Path storePath = ConfigPaths.resolveStorePath(settings.storePath());
        JobStoreLock lock = JobStoreLock.acquire(storePath);
        try {
            return wire(config, clock, agent, channels, new FileJobStore(storePath), lock);
        } catch (RuntimeException e) {
            lock.close();
            throw e;
        }
    }

    private static KairosRuntime wire(
        KairosConfig config,
        Clock clock,
        AgentClient agent,
        ChannelSender channels,
        FileJobStore store,
        JobStoreLock lock
    ) {
        SchedulerConfig settings = config.scheduler();
        JobCatalog catalog = new JobCatalog(store, settings.storeTimeout());
        ScheduleEvaluator evaluator = new ScheduleEvaluator(ConfigService.defaultZone(config));
        int workers = Math.max(1, settings.maxConcurrentJobs());

        JobExecutor executor = new JobExecutor(
            agent,
            channels,
            settings.agentTimeout(),
            settings.deliveryTimeout(),
            clock,
            workers * 2
        );
        JobScheduler scheduler = new JobScheduler(catalog, evaluator, executor, clock, workers, settings.shutdownGrace());
        ExecutionHistory history = new ExecutionHistory(Math.max(1, settings.historySize()));
        BoundedJobEventBus events = new BoundedJobEventBus(Math.max(1, settings.eventBufferSize()));
        scheduler.addListener(history).addListener(new JobEventListener(events, clock));
        JobService service = new JobService(catalog, evaluator, scheduler, events, clock);
        return new KairosRuntime(store, lock, executor, scheduler, service, history, events);
    }

    static AgentClient buildAgent(AgentConfig agent) {
        if (agent == null || !agent.configured()) {
            return new DisabledAgentClient("missing API key");
        }
        return new OpenAiCompatAgentClient(
            agent.name() == null || agent.name().isBlank() ? "agent" : agent.name(),
            agent.apiKey(),
            agent.apiBase(),
            agent.model(),
            agent.systemPrompt()
        );
    }

    static ChannelRegistry buildChannels(ChannelsConfig channels) {
        ChannelRegistry registry = new ChannelRegistry();
        for (Map.Entry<ChannelKind, ChannelConfig> entry : channels.byKind().entrySet()) {
            ChannelConfig channel = entry.getValue();
            if (!channel.usable()) {
                continue;
            }
            switch (entry.getKey()) {
                case TELEGRAM -> registry.register(ChannelKind.TELEGRAM,
                    new TelegramChannelSender(channel.token(), channel.apiBase()));
                case SLACK -> registry.register(ChannelKind.SLACK,
                    new SlackChannelSender(channel.token(), channel.apiBase()));
                default -> LOG.warn("Channel {} is enabled but has no built-in sender; deliveries to it will fail",
                    entry.getKey().id());
            }
        }
        return registry;
    }

    public void start() {
        scheduler.start();
    }

    public Path storePath() {
        return store.path();
    }

    public JobScheduler scheduler() {
        return scheduler;
    }

    public JobService service() {
        return service;
    }

    public ExecutionHistory history() {
        return history;
    }

    public BoundedJobEventBus events() {
        return events;
    }

    @Override
    public void close() {
        try {
            scheduler.close();
            executor.close();
        } finally {
            lock.close();
        }
    }
}

package io.kairos.cli;

import io.kairos.core.channel.ChannelKind;
import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.model.ChannelConfig;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.job.Job;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

@Command(name = "status", description = "Show configuration and job status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Mixin
    GatewayOption gateway;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            KairosConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Job store: " + ConfigPaths.resolveStorePath(config.scheduler().storePath()));
            System.out.println("Gateway: " + config.gateway().baseUrl());
            System.out.println("Agent: " + config.agent().name() + " / " + config.agent().model()
                + (config.agent().configured() ? "" : " (missing API key)"));

            for (Map.Entry<ChannelKind, ChannelConfig> entry : config.channels().byKind().entrySet()) {
                ChannelConfig channel = entry.getValue();
                String state = channel.usable() ? "configured" : channel.enabled() ? "enabled, missing token" : "off";
                System.out.println("Channel " + entry.getKey().id() + ": " + state);
            }

            try (OpenRegistry open = context.registries().open(gateway.url)) {
                List<Job> jobs = open.registry().listJobs(true);
                long enabled = jobs.stream().filter(Job::enabled).count();
                System.out.println("Jobs: " + jobs.size() + " total, " + enabled + " enabled");
                jobs.stream()
                    .filter(Job::enabled)
                    .filter(job -> job.state().nextRunAtMs() != null)
                    .min((left, right) -> Long.compare(left.state().nextRunAtMs(), right.state().nextRunAtMs()))
                    .ifPresent(job -> System.out.println(
                        "Next due: " + job.name() + " at " + JobFormatter.time(job.state().nextRunAtMs())
                    ));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}

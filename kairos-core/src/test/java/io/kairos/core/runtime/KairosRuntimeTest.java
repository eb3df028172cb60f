package io.kairos.core.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kairos.core.agent.AgentClient;
import io.kairos.core.agent.DisabledAgentClient;
import io.kairos.core.agent.OpenAiCompatAgentClient;
import io.kairos.core.channel.ChannelKind;
import io.kairos.core.channel.ChannelRegistry;
import io.kairos.core.channel.DeliveryException;
import io.kairos.core.config.model.AgentConfig;
import io.kairos.core.config.model.ChannelConfig;
import io.kairos.core.config.model.ChannelsConfig;
import io.kairos.core.job.Job;
import io.kairos.core.job.JobPayload;
import io.kairos.core.job.JobSchedule;
import io.kairos.core.job.JobStatus;
import io.kairos.core.observability.ExecutionRecord;
import io.kairos.core.store.JobStoreLockedException;
import io.kairos.core.support.MutableClock;
import io.kairos.core.support.RecordingChannelSender;
import io.kairos.core.support.ScriptedAgentClient;
import io.kairos.core.support.TestConfigs;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KairosRuntimeTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRegisterSendersOnlyForUsableChannelsWithBuiltInSupport() {
        ChannelConfig on = new ChannelConfig(true, "token", null, List.of());
        ChannelConfig off = ChannelConfig.defaults();
        ChannelsConfig channels = new ChannelsConfig(on, off, on, on, off, off, off, off, off);

        ChannelRegistry registry = KairosRuntime.buildChannels(channels);

        assertThat(registry.configured()).containsExactlyInAnyOrder(ChannelKind.TELEGRAM, ChannelKind.SLACK);
        assertThatThrownBy(() -> registry.send("discord", "1", "hi", Duration.ofSeconds(1)))
            .isInstanceOf(DeliveryException.class)
            .hasMessage("channel discord is not configured");
    }

    @Test
    void shouldUseDisabledAgentWithoutApiKey() {
        AgentClient missing = KairosRuntime.buildAgent(AgentConfig.defaults());
        AgentConfig defaults = AgentConfig.defaults();
        AgentClient configured = KairosRuntime.buildAgent(
            new AgentConfig("openrouter", defaults.apiBase(), "sk-test", defaults.model(), defaults.systemPrompt())
        );

        assertThat(missing).isInstanceOf(DisabledAgentClient.class);
        assertThat(configured).isInstanceOf(OpenAiCompatAgentClient.class);
        assertThat(configured.name()).isEqualTo("openrouter");
    }

    @Test
    void shouldWireServiceHistoryAndEventsAroundStore() throws Exception {
        RecordingChannelSender channels = new RecordingChannelSender();
        try (KairosRuntime runtime = KairosRuntime.create(
            TestConfigs.storeIn(tempDir), new MutableClock(5_000), new ScriptedAgentClient(), channels
        )) {
            Job job = runtime.service().addJob("ping", JobSchedule.every(60_000), JobPayload.delivered("hello", "slack", "C1"));

            assertThat(runtime.service().runJob(job.id(), false)).isTrue();

            assertThat(runtime.storePath()).isEqualTo(tempDir.resolve("jobs.json"));
            assertThat(Files.readString(runtime.storePath())).contains("\"ping\"");
            assertThat(runtime.history().recent(1)).extracting(ExecutionRecord::status).containsExactly(JobStatus.SUCCESS);
            assertThat(runtime.events().recent(10)).hasSize(3);
            assertThat(channels.deliveries()).containsExactly(new RecordingChannelSender.Delivery("slack", "C1", "echo: hello"));
        }
    }

    @Test
    void shouldHoldStoreExclusivelyUntilClosed() {
        KairosRuntime owner = KairosRuntime.create(
            TestConfigs.storeIn(tempDir), new MutableClock(5_000), new ScriptedAgentClient(), new RecordingChannelSender()
        );
        Job job = owner.service().addJob("ping", JobSchedule.every(60_000), JobPayload.message("hello"));

        assertThatThrownBy(() -> KairosRuntime.create(
            TestConfigs.storeIn(tempDir), new MutableClock(5_000), new ScriptedAgentClient(), new RecordingChannelSender()
        ))
            .isInstanceOf(JobStoreLockedException.class)
            .hasMessageContaining("is in use by another process");
        owner.close();

        try (KairosRuntime reopened = KairosRuntime.create(
            TestConfigs.storeIn(tempDir), new MutableClock(5_000), new ScriptedAgentClient(), new RecordingChannelSender()
        )) {
            assertThat(reopened.service().listJobs(true)).extracting(Job::id).containsExactly(job.id());
        }
    }
}

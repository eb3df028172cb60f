package io.kairos.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.kairos.core.agent.AgentClient;
import io.kairos.core.agent.AgentException;
import io.kairos.core.agent.AgentSession;
import io.kairos.core.config.ConfigService;
import io.kairos.core.job.Job;
import io.kairos.core.runtime.KairosRuntime;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobCommandsIntegrationTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private final ConfigService configService = new ConfigService();
    private final List<String> deliveries = new ArrayList<>();
    private Path configPath;
    private CliContext context;

    private final AgentClient agent = new AgentClient() {
        @Override
        public String name() {
            return "test";
        }

        @Override
        public String submit(String message, AgentSession session, Duration timeout) throws AgentException {
            if (message.startsWith("fail")) {
                throw new AgentException("model overloaded");
            }
            return "pong: " + message;
        }
    };

    @BeforeEach
    void setUp() throws Exception {
        configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "scheduler": {
                "storePath": "%s",
                "defaultTimezone": "UTC"
              }
            }
            """.formatted(tempDir.resolve("jobs.json").toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
        context = new CliContext(configService, configPath, CLOCK, url -> {
            KairosRuntime runtime = KairosRuntime.create(
                configService.load(configPath),
                CLOCK,
                agent,
                (channel, recipient, content, timeout) -> deliveries.add(channel + ":" + recipient + " " + content)
            );
            return new OpenRegistry(runtime.service(), runtime);
        });
    }

    private Result execute(String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = KairosCommandLine.create(context).execute(args);
            return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private List<Job> storedJobs() throws Exception {
        try (OpenRegistry open = context.registries().open(null)) {
            return open.registry().listJobs(true);
        }
    }

    private record Result(int code, String out, String err) {
    }

    @Test
    void shouldAddListAndShowIntervalJob() throws Exception {
        Result added = execute("add", "ping", "-m", "hello", "--every", "60");

        assertThat(added.code()).isEqualTo(0);
        assertThat(added.out())
            .contains("Added job ping (")
            .contains("Schedule: every 60s")
            .contains("Next run: 2026-01-01T00:01:00Z");

        String id = storedJobs().get(0).id();
        assertThat(execute("list").out()).contains(id + "  ping  every 60s  enabled  next=2026-01-01T00:01:00Z");

        Result shown = execute("show", id);
        assertThat(shown.out()).contains("Id: " + id).contains("Enabled: true").contains("Last run: -");
    }

    @Test
    void shouldAddOneShotJobFromRelativeTime() throws Exception {
        Result added = execute(
            "add", "remind", "-m", "stand up", "--at", "in 10m", "--deliver", "--channel", "telegram", "--to", "42"
        );

        assertThat(added.code()).isEqualTo(0);
        assertThat(added.out()).contains("Next run: 2026-01-01T00:10:00Z");
        Job job = storedJobs().get(0);
        assertThat(job.schedule().oneShot()).isTrue();
        assertThat(job.payload().channel()).isEqualTo("telegram");
    }

    @Test
    void shouldRejectAmbiguousOrInvalidAdds() throws Exception {
        assertThat(execute("add", "x", "-m", "hi").code()).isEqualTo(2);
        assertThat(execute("add", "x", "-m", "hi", "--every", "60", "--cron", "* * * * *").code()).isEqualTo(2);

        Result missingChannel = execute("add", "x", "-m", "hi", "--every", "60", "--deliver", "--to", "42");
        assertThat(missingChannel.code()).isEqualTo(1);
        assertThat(missingChannel.err()).contains("Add failed: channel is required when deliver is set");

        Result badCron = execute("add", "x", "-m", "hi", "--cron", "61 * * * *");
        assertThat(badCron.code()).isEqualTo(1);
        assertThat(badCron.err()).startsWith("Add failed: ");

        Result hugeInterval = execute("add", "x", "-m", "hi", "--every", "9223372036854775807");
        assertThat(hugeInterval.code()).isEqualTo(1);
        assertThat(hugeInterval.err()).contains("Add failed: --every is too large");

        Result tooLargeForClock = execute("add", "x", "-m", "hi", "--every", "9223372036854775");
        assertThat(tooLargeForClock.code()).isEqualTo(1);
        assertThat(tooLargeForClock.err()).contains("Add failed: interval is too large");

        assertThat(storedJobs()).isEmpty();
    }

    @Test
    void shouldDisableRunForcedAndRemoveJob() throws Exception {
        execute("add", "report", "-m", "summarize", "--cron", "0 9 * * *", "--deliver", "--channel", "slack", "--to", "C1");
        String id = storedJobs().get(0).id();

        Result disabled = execute("disable", id);
        assertThat(disabled.code()).isEqualTo(0);
        assertThat(disabled.out()).contains("Disabled job");
        assertThat(execute("list").out()).contains("No enabled jobs.");

        Result skipped = execute("run", id);
        assertThat(skipped.code()).isEqualTo(1);
        assertThat(skipped.err()).contains("did not run: disabled or already running");

        Result forced = execute("run", "--force", id);
        assertThat(forced.code()).isEqualTo(0);
        assertThat(forced.out()).contains("Job report (" + id + ") succeeded");
        assertThat(deliveries).containsExactly("slack:C1 pong: summarize");
        assertThat(storedJobs().get(0).enabled()).isFalse();

        Result removed = execute("rm", id);
        assertThat(removed.code()).isEqualTo(0);
        assertThat(removed.out()).contains("Removed job " + id);
        assertThat(storedJobs()).isEmpty();
    }

    @Test
    void shouldReportFailedRunAndUnknownJob() throws Exception {
        execute("add", "broken", "-m", "fail now", "--every", "60");
        String id = storedJobs().get(0).id();

        Result failed = execute("run", id);
        assertThat(failed.code()).isEqualTo(1);
        assertThat(failed.err()).contains("failed: model overloaded");

        Result missing = execute("enable", "nope");
        assertThat(missing.code()).isEqualTo(1);
        assertThat(missing.err()).contains("Enable failed: job not found: nope");
    }

    @Test
    void shouldPrintStatus() {
        execute("add", "ping", "-m", "hello", "--every", "120");

        Result status = execute("status");

        assertThat(status.code()).isEqualTo(0);
        assertThat(status.out())
            .contains("Job store: " + tempDir.resolve("jobs.json"))
            .contains("Agent: openrouter / anthropic/claude-sonnet-4 (missing API key)")
            .contains("Channel telegram: off")
            .contains("Jobs: 1 total, 1 enabled")
            .contains("Next due: ping at 2026-01-01T00:02:00Z");
    }

    @Test
    void shouldRefreshExistingConfigOnOnboard() throws Exception {
        Result onboard = execute("onboard");

        assertThat(onboard.code()).isEqualTo(0);
        assertThat(onboard.out())
            .contains("Refreshed config with new defaults: " + configPath)
            .contains("Job store: " + tempDir.resolve("jobs.json"));
        assertThat(Files.readString(configPath)).contains("maxConcurrentJobs");
    }

    @Test
    void shouldHandServeOptionsToRunner() {
        List<String> calls = new ArrayList<>();
        context = new CliContext(configService, configPath, CLOCK, context.registries(), (port, follow) -> {
            calls.add(port + "/" + follow);
            return 0;
        });

        assertThat(execute("serve", "--port", "9001", "--follow").code()).isEqualTo(0);
        assertThat(execute("serve").code()).isEqualTo(0);
        assertThat(calls).containsExactly("9001/true", "null/false");
    }
}

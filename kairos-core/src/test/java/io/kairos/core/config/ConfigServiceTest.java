package io.kairos.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.kairos.core.channel.ChannelKind;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.config.model.SchedulerConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        KairosConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.scheduler().maxConcurrentJobs()).isEqualTo(4);
        assertThat(config.scheduler().agentTimeout()).isEqualTo(Duration.ofSeconds(120));
        assertThat(config.agent().configured()).isFalse();
        assertThat(config.gateway().baseUrl()).isEqualTo("http://127.0.0.1:8790");
        assertThat(config.channels().byKind()).hasSize(ChannelKind.values().length);
    }

    @Test
    void shouldMergeFileOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "scheduler": {
                "maxConcurrentJobs": 8,
                "defaultTimezone": "Asia/Tokyo"
              },
              "agent": {
                "apiKey": "sk-test"
              },
              "channels": {
                "slack": { "enabled": true, "token": "xoxb-1" }
              }
            }
            """);

        KairosConfig config = service.load(configPath);

        assertThat(config.scheduler().maxConcurrentJobs()).isEqualTo(8);
        assertThat(config.scheduler().historySize()).isEqualTo(200);
        assertThat(config.agent().configured()).isTrue();
        assertThat(config.agent().model()).isEqualTo("anthropic/claude-sonnet-4");
        assertThat(config.channels().byKind().get(ChannelKind.SLACK).usable()).isTrue();
        assertThat(config.channels().byKind().get(ChannelKind.TELEGRAM).usable()).isFalse();
        assertThat(ConfigService.defaultZone(config)).isEqualTo(ZoneId.of("Asia/Tokyo"));
    }

    @Test
    void onboardShouldKeepUserValuesAndCreateStoreDirectory() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".kairos/config.json");
        Path storePath = tempDir.resolve("data/cron/jobs.json");
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, """
            { "scheduler": { "storePath": "%s" } }
            """.formatted(storePath.toString().replace("\\", "\\\\")));

        OnboardResult result = service.onboard(configPath, false);

        assertThat(result.createdConfig()).isFalse();
        assertThat(result.overwrittenConfig()).isFalse();
        assertThat(result.storePath()).isEqualTo(storePath);
        assertThat(Files.isDirectory(storePath.getParent())).isTrue();
        assertThat(service.load(configPath).scheduler().historySize()).isEqualTo(200);
        assertThat(Files.readString(configPath)).contains("historySize");
    }

    @Test
    void shouldRejectUnknownDefaultTimezone() {
        SchedulerConfig scheduler = SchedulerConfig.defaults();
        KairosConfig defaults = KairosConfig.defaults();
        KairosConfig config = new KairosConfig(
            new SchedulerConfig(
                scheduler.storePath(), "Nowhere/City", scheduler.agentTimeoutSeconds(), scheduler.deliveryTimeoutSeconds(),
                scheduler.storeTimeoutSeconds(), scheduler.shutdownGraceSeconds(), scheduler.maxConcurrentJobs(),
                scheduler.historySize(), scheduler.eventBufferSize()
            ),
            defaults.agent(),
            defaults.gateway(),
            defaults.channels()
        );

        assertThatThrownBy(() -> ConfigService.defaultZone(config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Nowhere/City");
    }

    @Test
    void shouldExpandHomeInStorePath() {
        Path resolved = ConfigPaths.resolveStorePath("~/jobs/store.json");

        assertThat(resolved).isEqualTo(Path.of(System.getProperty("user.home"), "jobs", "store.json"));
        assertThat(ConfigPaths.resolveStorePath(" ")).isEqualTo(ConfigPaths.kairosHome().resolve("cron/jobs.json"));
    }
}

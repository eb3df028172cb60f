package io.kairos.app;

import io.kairos.cli.CliContext;
import io.kairos.cli.DefaultRegistryProvider;
import io.kairos.cli.KairosCommandLine;
import io.kairos.core.config.ConfigPaths;
import io.kairos.core.config.ConfigService;
import io.kairos.core.runtime.KairosRuntime;
import java.nio.file.Path;
import java.time.Clock;

public final class KairosApplication {

    private KairosApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        Clock clock = Clock.systemUTC();

        CliContext context = new CliContext(
            configService,
            configPath,
            clock,
            new DefaultRegistryProvider(configService, configPath, config -> KairosRuntime.fromConfig(config, clock)),
            (port, follow) -> new DaemonRunner(configService, configPath, clock).run(port, follow)
        );

        int exitCode = KairosCommandLine.create(context).execute(args);
        System.exit(exitCode);
    }
}

package io.kairos.cli;

import io.kairos.core.config.ConfigService;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Clock clock,
    RegistryProvider registries,
    ServeRunner serveRunner
) {
    public CliContext(ConfigService configService, Path configPath, Clock clock, RegistryProvider registries) {
        this(configService, configPath, clock, registries, (port, follow) -> {
            throw new UnsupportedOperationException("serve runner is not configured");
        });
    }
}

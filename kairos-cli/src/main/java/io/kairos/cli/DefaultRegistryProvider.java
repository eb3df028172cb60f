package io.kairos.cli;

import io.kairos.core.config.ConfigService;
import io.kairos.core.config.model.GatewayConfig;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.registry.HttpJobRegistry;
import io.kairos.core.runtime.KairosRuntime;
import io.kairos.core.store.JobStoreLockedException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * Opens the gateway given by {@code --url}, otherwise a local runtime on the configured store.
 *
 * <p>When a running daemon owns the store, commands are sent to the gateway from the config
 * instead, so the daemon stays the only writer.
 */
public final class DefaultRegistryProvider implements RegistryProvider {
    private final ConfigService configService;
    private final Path configPath;
    private final Function<KairosConfig, KairosRuntime> runtimes;

    public DefaultRegistryProvider(
        ConfigService configService,
        Path configPath,
        Function<KairosConfig, KairosRuntime> runtimes
    ) {
        this.configService = Objects.requireNonNull(configService, "configService must not be null");
        this.configPath = Objects.requireNonNull(configPath, "configPath must not be null");
        this.runtimes = Objects.requireNonNull(runtimes, "runtimes must not be null");
    }

    @Override
    public OpenRegistry open(String gatewayUrl) throws Exception {
        if (gatewayUrl != null && !gatewayUrl.isBlank()) {
            return OpenRegistry.of(new HttpJobRegistry(gatewayUrl.trim()));
        }
        KairosConfig config = configService.load(configPath);
        try {
            KairosRuntime runtime = runtimes.apply(config);
            return new OpenRegistry(runtime.service(), runtime);
        } catch (JobStoreLockedException e) {
            String url = daemonUrl(config.gateway());
            System.err.println("Job store is in use by a running daemon; using its gateway at " + url);
            return OpenRegistry.of(new HttpJobRegistry(url));
        }
    }

    static String daemonUrl(GatewayConfig gateway) {
        String host = gateway.host();
        if (host == null || host.isBlank() || "0.0.0.0".equals(host) || "::".equals(host)) {
            return "http://127.0.0.1:" + gateway.port();
        }
        return gateway.baseUrl();
    }
}

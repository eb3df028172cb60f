package io.kairos.core.support;

import io.kairos.core.config.model.AgentConfig;
import io.kairos.core.config.model.ChannelsConfig;
import io.kairos.core.config.model.GatewayConfig;
import io.kairos.core.config.model.KairosConfig;
import io.kairos.core.config.model.SchedulerConfig;
import java.nio.file.Path;

public final class TestConfigs {

    private TestConfigs() {
    }

    /**
     * Short timeouts, a UTC default zone and a store under {@code dir}.
     */
    public static KairosConfig storeIn(Path dir) {
        return new KairosConfig(
            new SchedulerConfig(dir.resolve("jobs.json").toString(), "UTC", 5, 5, 5, 1, 2, 50, 50),
            AgentConfig.defaults(),
            new GatewayConfig("127.0.0.1", 0),
            ChannelsConfig.defaults()
        );
    }
}

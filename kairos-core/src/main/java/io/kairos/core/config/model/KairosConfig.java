package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KairosConfig(
    SchedulerConfig scheduler,
    AgentConfig agent,
    GatewayConfig gateway,
    ChannelsConfig channels
) {

    public static KairosConfig defaults() {
        return new KairosConfig(
            SchedulerConfig.defaults(),
            AgentConfig.defaults(),
            GatewayConfig.defaults(),
            ChannelsConfig.defaults()
        );
    }
}

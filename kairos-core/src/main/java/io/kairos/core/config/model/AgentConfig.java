package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentConfig(
    String name,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"api_key"}) String apiKey,
    String model,
    @JsonAlias({"system_prompt"}) String systemPrompt
) {

    public static AgentConfig defaults() {
        return new AgentConfig(
            "openrouter",
            "https://openrouter.ai/api/v1",
            "",
            "anthropic/claude-sonnet-4",
            "You are running a scheduled task. Answer concisely."
        );
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}

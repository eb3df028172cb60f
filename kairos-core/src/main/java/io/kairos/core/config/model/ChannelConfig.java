package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChannelConfig(
    boolean enabled,
    String token,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"allow_from"}) List<String> allowFrom
) {

    public ChannelConfig {
        allowFrom = allowFrom == null ? List.of() : List.copyOf(allowFrom);
    }

    public static ChannelConfig defaults() {
        return new ChannelConfig(false, "", null, List.of());
    }

    public boolean usable() {
        return enabled && token != null && !token.isBlank();
    }
}

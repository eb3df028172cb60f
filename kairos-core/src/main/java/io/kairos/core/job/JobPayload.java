package io.kairos.core.job;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobPayload(
    String message,
    boolean deliver,
    String channel,
    @JsonAlias({"to"}) String recipient
) {
    public JobPayload {
        channel = channel == null || channel.isBlank() ? null : channel.trim();
        recipient = recipient == null || recipient.isBlank() ? null : recipient.trim();
    }

    public static JobPayload message(String message) {
        return new JobPayload(message, false, null, null);
    }

    public static JobPayload delivered(String message, String channel, String recipient) {
        return new JobPayload(message, true, channel, recipient);
    }
}

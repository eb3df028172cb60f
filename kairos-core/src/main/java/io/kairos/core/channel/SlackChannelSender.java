package io.kairos.core.channel;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

/**
 * Delivers through Slack's {@code chat.postMessage}. The recipient is a channel or user id.
 */
public final class SlackChannelSender extends JsonApiChannelSender {
    public static final String DEFAULT_API_BASE = "https://slack.com/api";

    private final HttpUrl endpoint;
    private final String botToken;

    public SlackChannelSender(String botToken, String apiBase) {
        super(new OkHttpClient.Builder().connectTimeout(Duration.ofSeconds(10)).build());
        this.botToken = Objects.requireNonNull(botToken, "botToken must not be null");
        String base = apiBase == null || apiBase.isBlank() ? DEFAULT_API_BASE : apiBase;
        this.endpoint = HttpUrl.get(base).newBuilder().addPathSegment("chat.postMessage").build();
    }

    @Override
    HttpUrl endpoint() {
        return endpoint;
    }

    @Override
    Map<String, String> headers() {
        return Map.of("Authorization", "Bearer " + botToken);
    }

    @Override
    Map<String, Object> body(String recipient, String content) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", recipient);
        body.put("text", content == null ? "" : content);
        return body;
    }

    @Override
    String errorOf(JsonNode response) {
        return response.path("error").asText("unknown error");
    }
}

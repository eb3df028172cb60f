package io.kairos.core.channel;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

/**
 * Delivers through the Telegram Bot API {@code sendMessage} method. The recipient is a chat id.
 */
public final class TelegramChannelSender extends JsonApiChannelSender {
    public static final String DEFAULT_API_BASE = "https://api.telegram.org";

    private final HttpUrl endpoint;

    public TelegramChannelSender(String botToken, String apiBase) {
        super(new OkHttpClient.Builder().connectTimeout(Duration.ofSeconds(10)).build());
        Objects.requireNonNull(botToken, "botToken must not be null");
        String base = apiBase == null || apiBase.isBlank() ? DEFAULT_API_BASE : apiBase;
        this.endpoint = HttpUrl.get(base).newBuilder()
            .addPathSegment("bot" + botToken)
            .addPathSegment("sendMessage")
            .build();
    }

    @Override
    HttpUrl endpoint() {
        return endpoint;
    }

    @Override
    Map<String, String> headers() {
        return Map.of();
    }

    @Override
    Map<String, Object> body(String recipient, String content) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", recipient);
        body.put("text", content == null ? "" : content);
        return body;
    }

    @Override
    String errorOf(JsonNode response) {
        return response.path("description").asText("unknown error");
    }
}

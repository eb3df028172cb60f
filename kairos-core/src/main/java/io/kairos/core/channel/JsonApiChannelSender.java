package io.kairos.core.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Base for bot APIs that accept a JSON post and answer with {@code {"ok": true|false, ...}}.
 */
abstract class JsonApiChannelSender implements ChannelSender {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    JsonApiChannelSender(OkHttpClient client) {
        this.client = client;
        this.mapper = new ObjectMapper();
    }

    abstract HttpUrl endpoint();

    abstract Map<String, String> headers();

    abstract Map<String, Object> body(String recipient, String content);

    /**
     * Extracts the failure reason from a response whose {@code ok} flag is false.
     */
    abstract String errorOf(JsonNode response);

    @Override
    public void send(String channel, String recipient, String content, Duration timeout) throws DeliveryException {
        if (recipient == null || recipient.isBlank()) {
            throw new DeliveryException("recipient is required for " + channel);
        }
        Request.Builder builder = new Request.Builder().url(endpoint());
        headers().forEach(builder::header);
        try {
            builder.post(RequestBody.create(mapper.writeValueAsString(body(recipient, content)), JSON));
        } catch (IOException e) {
            throw new DeliveryException("failed to encode " + channel + " message", e);
        }

        Call call = client.newCall(builder.build());
        call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        try (Response response = call.execute()) {
            String raw = response.body() == null ? "" : response.body().string();
            JsonNode payload = raw.isBlank() ? mapper.createObjectNode() : mapper.readTree(raw);
            if (!response.isSuccessful() || !payload.path("ok").asBoolean(false)) {
                throw new DeliveryException(
                    channel + " returned HTTP " + response.code() + ": " + errorOf(payload)
                );
            }
        } catch (IOException e) {
            throw new DeliveryException(channel + " request failed: " + e.getMessage(), e);
        }
    }
}

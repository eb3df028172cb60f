package io.kairos.core.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agent reached through an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>Only HTTP 429 is retried, with exponential backoff while the caller's timeout allows. Any
 * other failure ends the invocation so a message the agent may have processed is never resent.
 * The response may be plain JSON or an event stream.
 */
public final class OpenAiCompatAgentClient implements AgentClient {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatAgentClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final long MAX_BACKOFF_MS = 2_000;

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final String model;
    private final String systemPrompt;
    private final int maxAttempts;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public OpenAiCompatAgentClient(String name, String apiKey, String apiBase, String model, String systemPrompt) {
        this(name, apiKey, apiBase, model, systemPrompt, 3);
    }

    public OpenAiCompatAgentClient(
        String name,
        String apiKey,
        String apiBase,
        String model,
        String systemPrompt,
        int maxAttempts
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.systemPrompt = systemPrompt == null ? "" : systemPrompt;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String submit(String message, AgentSession session, Duration timeout) throws AgentException {
        if (apiKey.isBlank()) {
            throw new AgentException("missing API key for agent " + name);
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        long backoffMs = 250;
        String lastFailure = "no attempt made";

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                break;
            }
            Call call = client.newCall(buildRequest(message, session));
            call.timeout().timeout(remainingMs, TimeUnit.MILLISECONDS);
            try (Response response = call.execute()) {
                if (response.isSuccessful()) {
                    return parse(response);
                }
                String body = response.body() == null ? "" : response.body().string();
                lastFailure = "HTTP " + response.code() + " " + truncate(body, 300);
                // Only a rate-limit rejection is known to leave the message unprocessed.
                if (response.code() != 429) {
                    throw new AgentException("agent " + name + " rejected the request: " + lastFailure);
                }
            } catch (InterruptedIOException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new AgentException("agent " + name + " call interrupted", e);
                }
                throw new AgentException("agent " + name + " timed out after " + timeout, e);
            } catch (IOException e) {
                throw new AgentException("agent " + name + " failed: " + e.getMessage(), e);
            }

            if (attempt < maxAttempts) {
                LOG.debug("Agent {} attempt {} failed for job {}: {}", name, attempt, session.jobId(), lastFailure);
                sleep(Math.min(backoffMs, Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()))));
                backoffMs = Math.min(backoffMs * 2, MAX_BACKOFF_MS);
            }
        }
        throw new AgentException("agent " + name + " failed: " + lastFailure);
    }

    private Request buildRequest(String message, AgentSession session) throws AgentException {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (!systemPrompt.isBlank()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", message == null ? "" : message));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", messages);
        payload.put("user", session.sessionKey());
        payload.put("stream", false);

        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new AgentException("failed to encode agent request", e);
        }
        return new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("chat").addPathSegment("completions").build())
            .post(RequestBody.create(json, JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json, text/event-stream")
            .header("X-Session-Key", session.sessionKey())
            .build();
    }

    private String parse(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            return "";
        }
        String contentType = response.header("Content-Type", "");
        if (contentType.contains("text/event-stream")) {
            return parseStream(body.source());
        }
        JsonNode root = mapper.readTree(body.string());
        return root.path("choices").path(0).path("message").path("content").asText("");
    }

    private String parseStream(BufferedSource source) throws IOException {
        StringBuilder content = new StringBuilder();
        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null || !line.startsWith("data:")) {
                continue;
            }
            String data = line.substring(5).trim();
            if (data.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(data)) {
                break;
            }
            for (JsonNode choice : mapper.readTree(data).path("choices")) {
                JsonNode delta = choice.path("delta").path("content");
                if (!delta.isMissingNode() && !delta.isNull()) {
                    content.append(delta.asText(""));
                }
            }
        }
        return content.toString();
    }

    private String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }

    private void sleep(long delayMs) throws AgentException {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException("interrupted while waiting to retry agent " + name, e);
        }
    }
}

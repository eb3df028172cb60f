package io.kairos.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kairos.core.bus.JobEventBus;
import io.kairos.core.job.JobNotFoundException;
import io.kairos.core.job.JobValidationException;
import io.kairos.core.observability.ExecutionHistory;
import io.kairos.core.registry.AddJobRequest;
import io.kairos.core.registry.JobRegistry;
import io.kairos.core.store.JobStoreException;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP surface of the daemon: job management, recent executions and the event stream.
 */
public final class JobsGatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobsGatewayServer.class);
    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final JobRegistry registry;
    private final ExecutionHistory history;
    private final JobEventBus events;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public JobsGatewayServer(
        int port,
        String host,
        JobRegistry registry,
        ExecutionHistory history,
        JobEventBus events
    ) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addPrefixPath("/jobs", this::blocking)
            .addExactPath("/executions", this::handleExecutions)
            .addExactPath("/events", this::handleEvents);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Jobs gateway listening on http://{}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (running.getAndSet(false) && server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleExecutions(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        int limit = parseQueryInt(exchange, "limit", DEFAULT_LIMIT, 1, MAX_LIMIT);
        String jobId = queryParam(exchange, "job_id");
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("executions", jobId.isBlank() ? history.recent(limit) : history.recentFor(jobId, limit));
        response.put("summary", history.summary());
        sendJson(exchange, 200, response);
    }

    private void handleEvents(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        int limit = parseQueryInt(exchange, "limit", DEFAULT_LIMIT, 1, MAX_LIMIT);
        sendJson(exchange, 200, Map.of("events", events.recent(limit)));
    }

    /**
     * Job routes touch the store and may wait for a manual run, so they leave the IO thread.
     */
    private void blocking(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> blocking(exchange));
            return;
        }
        try {
            routeJobs(exchange);
        } catch (JobValidationException e) {
            send(exchange, 400, Map.of("error", e.getMessage()));
        } catch (JobNotFoundException e) {
            send(exchange, 404, Map.of("error", e.getMessage(), "job_id", e.jobId()));
        } catch (JobStoreException e) {
            LOG.warn("Job store unavailable: {}", e.getMessage());
            send(exchange, 503, Map.of("error", e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            send(exchange, 503, Map.of("error", "interrupted"));
        } catch (Exception e) {
            LOG.error("Gateway request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            send(exchange, 500, Map.of("error", "internal_error"));
        }
    }

    private void routeJobs(HttpServerExchange exchange) throws Exception {
        String relative = exchange.getRelativePath().replaceAll("^/+|/+$", "");
        if (relative.isEmpty()) {
            handleJobsCollection(exchange);
            return;
        }
        List<String> segments = List.of(relative.split("/+"));
        String id = segments.get(0);
        if (segments.size() == 1) {
            handleJob(exchange, id);
            return;
        }
        if (segments.size() == 2 && isMethod(exchange, "POST")) {
            switch (segments.get(1)) {
                case "enable" -> sendJson(exchange, 200, toMap(registry.enableJob(id, true)));
                case "disable" -> sendJson(exchange, 200, toMap(registry.enableJob(id, false)));
                case "run" -> {
                    boolean force = Boolean.parseBoolean(queryParam(exchange, "force"));
                    boolean succeeded = registry.runJob(id, force);
                    sendJson(exchange, 200, Map.of("job_id", id, "forced", force, "succeeded", succeeded));
                }
                default -> sendJson(exchange, 404, Map.of("error", "not_found"));
            }
            return;
        }
        if (segments.size() == 2) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 404, Map.of("error", "not_found"));
    }

    private void handleJobsCollection(HttpServerExchange exchange) throws IOException {
        if (isMethod(exchange, "GET")) {
            boolean includeDisabled = Boolean.parseBoolean(queryParam(exchange, "include_disabled"));
            sendJson(exchange, 200, Map.of("jobs", registry.listJobs(includeDisabled)));
            return;
        }
        if (isMethod(exchange, "POST")) {
            AddJobRequest request = readBody(exchange);
            sendJson(exchange, 201, toMap(registry.addJob(request.name(), request.schedule(), request.payload())));
            return;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
    }

    private void handleJob(HttpServerExchange exchange, String id) throws IOException {
        if (isMethod(exchange, "GET")) {
            sendJson(exchange, 200, toMap(registry.getJob(id)));
            return;
        }
        if (isMethod(exchange, "DELETE")) {
            registry.removeJob(id);
            sendJson(exchange, 200, Map.of("removed", id));
            return;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
    }

    private AddJobRequest readBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            throw new JobValidationException("request body is required");
        }
        try {
            return mapper.readValue(bytes, AddJobRequest.class);
        } catch (IOException e) {
            throw new JobValidationException("invalid job request: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toMap(Object value) {
        return mapper.convertValue(value, Map.class);
    }

    private void send(HttpServerExchange exchange, int status, Map<String, ?> payload) {
        try {
            sendJson(exchange, status, payload);
        } catch (IOException e) {
            LOG.warn("Failed to write gateway response: {}", e.getMessage());
            exchange.endExchange();
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private static boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private static String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        return values == null || values.isEmpty() ? "" : values.getFirst().trim();
    }

    private static int parseQueryInt(HttpServerExchange exchange, String key, int fallback, int min, int max) {
        try {
            int parsed = Integer.parseInt(queryParam(exchange, key));
            return Math.max(min, Math.min(max, parsed));
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}

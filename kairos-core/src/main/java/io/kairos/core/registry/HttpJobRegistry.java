package io.kairos.core.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kairos.core.job.Job;
import io.kairos.core.job.JobNotFoundException;
import io.kairos.core.job.JobPayload;
import io.kairos.core.job.JobSchedule;
import io.kairos.core.job.JobValidationException;
import io.kairos.core.job.KairosException;
import io.kairos.core.store.JobStoreException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * {@link JobRegistry} backed by the HTTP gateway of a running daemon, so that the daemon stays the
 * only writer of the job store.
 */
public final class HttpJobRegistry implements JobRegistry {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final RequestBody EMPTY = RequestBody.create(new byte[0], JSON);

    private final HttpUrl baseUrl;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public HttpJobRegistry(String baseUrl) {
        this(baseUrl, Duration.ofMinutes(5));
    }

    /**
     * @param callTimeout upper bound of one call, including manual runs that wait for the job
     */
    public HttpJobRegistry(String baseUrl, Duration callTimeout) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("invalid gateway url: " + baseUrl);
        }
        this.baseUrl = parsed;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(5))
            .readTimeout(callTimeout)
            .callTimeout(callTimeout)
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public Job addJob(String name, JobSchedule schedule, JobPayload payload) {
        Request request = new Request.Builder()
            .url(url("jobs"))
            .post(json(new AddJobRequest(name, schedule, payload)))
            .build();
        return mapper.convertValue(execute(request, null), Job.class);
    }

    @Override
    public List<Job> listJobs(boolean includeDisabled) {
        HttpUrl url = url("jobs").newBuilder()
            .addQueryParameter("include_disabled", String.valueOf(includeDisabled))
            .build();
        JsonNode body = execute(new Request.Builder().url(url).get().build(), null);
        return mapper.convertValue(body.path("jobs"), new TypeReference<List<Job>>() { });
    }

    @Override
    public Job getJob(String id) {
        JsonNode body = execute(new Request.Builder().url(url("jobs", id)).get().build(), id);
        return mapper.convertValue(body, Job.class);
    }

    @Override
    public Job enableJob(String id, boolean enabled) {
        Request request = new Request.Builder()
            .url(url("jobs", id, enabled ? "enable" : "disable"))
            .post(EMPTY)
            .build();
        return mapper.convertValue(execute(request, id), Job.class);
    }

    @Override
    public void removeJob(String id) {
        execute(new Request.Builder().url(url("jobs", id)).delete().build(), id);
    }

    @Override
    public boolean runJob(String id, boolean force) throws InterruptedException {
        HttpUrl url = url("jobs", id, "run").newBuilder()
            .addQueryParameter("force", String.valueOf(force))
            .build();
        JsonNode body = execute(new Request.Builder().url(url).post(EMPTY).build(), id);
        if (Thread.interrupted()) {
            throw new InterruptedException("interrupted while running job " + id);
        }
        return body.path("succeeded").asBoolean(false);
    }

    private JsonNode execute(Request request, String jobId) {
        try (Response response = client.newCall(request).execute()) {
            String raw = response.body() == null ? "" : response.body().string();
            JsonNode body = raw.isBlank() ? mapper.createObjectNode() : mapper.readTree(raw);
            if (response.isSuccessful()) {
                return body;
            }
            String error = body.path("error").asText("HTTP " + response.code());
            switch (response.code()) {
                case 400 -> throw new JobValidationException(error);
                case 404 -> throw jobId == null ? new KairosException(error) : new JobNotFoundException(jobId);
                case 503 -> throw new JobStoreException(error);
                default -> throw new KairosException("gateway returned HTTP " + response.code() + ": " + error);
            }
        } catch (InterruptedIOException e) {
            throw new KairosException("gateway call timed out: " + request.url(), e);
        } catch (IOException e) {
            throw new KairosException("gateway unreachable at " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    private RequestBody json(Object value) {
        try {
            return RequestBody.create(mapper.writeValueAsBytes(value), JSON);
        } catch (IOException e) {
            throw new KairosException("failed to encode request", e);
        }
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }
}

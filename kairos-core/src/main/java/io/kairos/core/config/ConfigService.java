package io.kairos.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kairos.core.config.model.KairosConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
    }

    /**
     * Reads the config file merged over {@link KairosConfig#defaults()}; a missing file yields the defaults.
     */
    public KairosConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return KairosConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(KairosConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, KairosConfig.class);
    }

    public void save(Path configPath, KairosConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        KairosConfig config;
        if (created || overwrite) {
            config = KairosConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path storePath = ConfigPaths.resolveStorePath(config.scheduler().storePath());
        Files.createDirectories(storePath.toAbsolutePath().getParent());
        return new OnboardResult(configPath, storePath, created, overwritten);
    }

    public String toPrettyJson(KairosConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    /**
     * Zone used for cron schedules without their own {@code tz}; falls back to the JVM zone.
     */
    public static ZoneId defaultZone(KairosConfig config) {
        String raw = config.scheduler().defaultTimezone();
        if (raw == null || raw.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("unknown scheduler.defaultTimezone: " + raw, e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}

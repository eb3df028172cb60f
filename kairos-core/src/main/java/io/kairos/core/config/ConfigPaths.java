package io.kairos.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path kairosHome() {
        return Path.of(System.getProperty("user.home"), ".kairos");
    }

    public static Path defaultConfigPath() {
        return kairosHome().resolve("config.json");
    }

    public static Path resolveStorePath(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return kairosHome().resolve("cron").resolve("jobs.json");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}

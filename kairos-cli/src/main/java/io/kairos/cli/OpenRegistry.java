package io.kairos.cli;

import io.kairos.core.registry.JobRegistry;

/**
 * A registry together with whatever must be released once the command is done with it.
 */
public record OpenRegistry(JobRegistry registry, AutoCloseable resources) implements AutoCloseable {

    public static OpenRegistry of(JobRegistry registry) {
        return new OpenRegistry(registry, () -> { });
    }

    @Override
    public void close() throws Exception {
        resources.close();
    }
}

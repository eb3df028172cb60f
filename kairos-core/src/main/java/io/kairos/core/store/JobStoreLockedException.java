package io.kairos.core.store;

import java.nio.file.Path;

/**
 * Raised when another scheduler instance already owns the job store.
 */
public final class JobStoreLockedException extends JobStoreException {
    private final Path storePath;

    public JobStoreLockedException(Path storePath) {
        super("job store " + storePath + " is in use by another process");
        this.storePath = storePath;
    }

    public Path storePath() {
        return storePath;
    }
}

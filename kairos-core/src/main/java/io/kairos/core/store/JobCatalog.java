package io.kairos.core.store;

import io.kairos.core.job.Job;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * The in-memory job collection and its single critical section.
 *
 * <p>Every read-modify-write runs under one lock: the mutation works on a copy, the copy is saved
 * through the {@link JobStore}, and only then does it replace the visible collection. A failed save
 * leaves the previous collection in place. Lock acquisition is bounded by {@code lockTimeout}.
 */
public final class JobCatalog {
    private final JobStore store;
    private final Duration lockTimeout;
    private final ReentrantLock lock = new ReentrantLock();
    private List<Job> jobs;

    public JobCatalog(JobStore store, Duration lockTimeout) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout must not be null");
    }

    @FunctionalInterface
    public interface Mutation<T> {
        T apply(List<Job> working);
    }

    public <T> T read(Function<List<Job>, T> reader) {
        acquire();
        try {
            return reader.apply(loaded());
        } finally {
            lock.unlock();
        }
    }

    public List<Job> snapshot() {
        return read(List::copyOf);
    }

    public Optional<Job> find(String id) {
        return read(all -> all.stream().filter(job -> job.id().equals(id)).findFirst());
    }

    /**
     * Applies {@code mutation} to a working copy and persists the copy if it changed.
     */
    public <T> T write(Mutation<T> mutation) {
        acquire();
        try {
            List<Job> current = loaded();
            List<Job> working = new ArrayList<>(current);
            T result = mutation.apply(working);
            if (!working.equals(current)) {
                List<Job> committed = List.copyOf(working);
                try {
                    store.save(committed);
                } catch (IOException e) {
                    throw new JobStoreException("failed to persist jobs: " + e.getMessage(), e);
                }
                jobs = committed;
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private List<Job> loaded() {
        if (jobs == null) {
            try {
                jobs = List.copyOf(store.load());
            } catch (IOException e) {
                throw new JobStoreException("failed to load jobs: " + e.getMessage(), e);
            }
        }
        return jobs;
    }

    private void acquire() {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new JobStoreException("timed out after " + lockTimeout + " waiting for the job store");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobStoreException("interrupted while waiting for the job store", e);
        }
    }
}

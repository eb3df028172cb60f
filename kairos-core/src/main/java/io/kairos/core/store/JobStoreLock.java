package io.kairos.core.store;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exclusive ownership of a job store, held as an OS file lock on a sibling {@code .lock} file.
 *
 * <p>The lock lives as long as the owning runtime, so a second process opening the same store
 * fails fast instead of writing over jobs the owner keeps in memory.
 */
public final class JobStoreLock implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobStoreLock.class);

    private final Path lockPath;
    private final FileChannel channel;
    private final FileLock lock;

    private JobStoreLock(Path lockPath, FileChannel channel, FileLock lock) {
        this.lockPath = lockPath;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * @throws JobStoreLockedException when another process or runtime already holds the store
     */
    public static JobStoreLock acquire(Path storePath) {
        Objects.requireNonNull(storePath, "storePath must not be null");
        Path store = storePath.toAbsolutePath().normalize();
        Path lockPath = store.resolveSibling(store.getFileName() + ".lock");
        FileChannel channel;
        try {
            Files.createDirectories(lockPath.getParent());
            channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new JobStoreException("cannot open job store lock " + lockPath, e);
        }

        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        } catch (IOException e) {
            closeQuietly(channel);
            throw new JobStoreException("cannot lock job store " + store, e);
        }
        if (lock == null) {
            closeQuietly(channel);
            throw new JobStoreLockedException(store);
        }
        LOG.debug("Acquired job store lock {}", lockPath);
        return new JobStoreLock(lockPath, channel, lock);
    }

    @Override
    public void close() {
        try {
            if (lock.isValid()) {
                lock.release();
            }
            channel.close();
            LOG.debug("Released job store lock {}", lockPath);
        } catch (IOException e) {
            throw new JobStoreException("cannot release job store lock " + lockPath, e);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            LOG.warn("Failed to close job store lock channel: {}", e.getMessage());
        }
    }
}

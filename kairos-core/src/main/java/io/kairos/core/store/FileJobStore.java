package io.kairos.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kairos.core.job.Job;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores the job collection as one pretty-printed JSON document.
 *
 * <p>Each save writes a sibling {@code .tmp} file, forces it to disk and renames it over the
 * document, so a reader only ever sees the previous or the new document. A temp file found on load
 * is the remainder of an interrupted save and is discarded.
 */
public final class FileJobStore implements JobStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileJobStore.class);

    private final Path path;
    private final Path tempPath;
    private final ObjectMapper mapper;

    public FileJobStore(Path path) {
        this.path = path.toAbsolutePath().normalize();
        this.tempPath = this.path.resolveSibling(this.path.getFileName() + ".tmp");
        this.mapper = new ObjectMapper();
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized List<Job> load() throws IOException {
        if (Files.deleteIfExists(tempPath)) {
            LOG.warn("Discarded incomplete job store write {}", tempPath);
        }
        if (!Files.exists(path)) {
            return List.of();
        }
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        if (raw.isBlank()) {
            return List.of();
        }
        try {
            JobDocument document = mapper.readValue(raw, JobDocument.class);
            if (document.version() > JobDocument.CURRENT_VERSION) {
                throw new JobStoreException(
                    "job store " + path + " has unsupported version " + document.version()
                );
            }
            return document.jobs();
        } catch (JsonProcessingException e) {
            throw new JobStoreException("job store is not a valid document: " + path, e);
        }
    }

    @Override
    public synchronized void save(List<Job> jobs) throws IOException {
        Files.createDirectories(path.getParent());
        String json = mapper.writerWithDefaultPrettyPrinter()
            .writeValueAsString(new JobDocument(JobDocument.CURRENT_VERSION, jobs));
        ByteBuffer buffer = ByteBuffer.wrap((json + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));

        try (FileChannel channel = FileChannel.open(
            tempPath,
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.TRUNCATE_EXISTING
        )) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }

        try {
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move unsupported for {}, falling back to replace", path);
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}

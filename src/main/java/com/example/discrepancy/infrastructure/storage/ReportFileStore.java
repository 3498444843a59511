package com.example.discrepancy.infrastructure.storage;

import com.example.discrepancy.infrastructure.config.DiscrepancyProperties;
import com.example.discrepancy.infrastructure.exception.ReportStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * Transient on-disk storage for uploaded reports and generated results.
 * Every artifact is named after its task id, so concurrent tasks never share a file.
 */
@Component
public class ReportFileStore {

    private static final Logger log = LoggerFactory.getLogger(ReportFileStore.class);
    private static final String INPUT_SUFFIX = "_input.xlsx";
    private static final String OUTPUT_SUFFIX = "_output.xlsx";
    private static final String PARTIAL_SUFFIX = ".part";

    private final Path directory;

    /**
     * Creates the store and its directory when it does not exist yet.
     *
     * @param properties storage settings
     * @throws ReportStorageException when the directory cannot be created
     */
    public ReportFileStore(DiscrepancyProperties properties) {
        this.directory = Path.of(properties.getStorage().getDirectory()).toAbsolutePath();
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new ReportStorageException("Unable to create the report directory.", directory, ex);
        }
    }

    public Path directory() {
        return directory;
    }

    public Path inputPath(String taskId) {
        return directory.resolve(taskId + INPUT_SUFFIX);
    }

    public Path outputPath(String taskId) {
        return directory.resolve(taskId + OUTPUT_SUFFIX);
    }

    /**
     * Copies an uploaded report into the store.
     *
     * @param taskId  owner of the artifact
     * @param content uploaded bytes, not closed by this method
     * @return location of the stored input
     */
    public Path saveInput(String taskId, InputStream content) {
        Path target = inputPath(taskId);
        try {
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException ex) {
            throw new ReportStorageException("Unable to store the uploaded report for task " + taskId, target, ex);
        }
    }

    /**
     * Writes a result next to its final location and moves it into place once complete,
     * so readers never observe a half-written workbook.
     *
     * @param taskId owner of the artifact
     * @param writer producer of the workbook bytes
     * @return location of the published output
     */
    public Path writeOutput(String taskId, OutputWriter writer) {
        Path target = outputPath(taskId);
        Path partial = directory.resolve(taskId + OUTPUT_SUFFIX + PARTIAL_SUFFIX);
        try {
            try (OutputStream outputStream = Files.newOutputStream(partial)) {
                writer.writeTo(outputStream);
            }
            return Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            delete(partial);
            throw new ReportStorageException("Unable to store the result for task " + taskId, target, ex);
        } catch (RuntimeException ex) {
            delete(partial);
            throw ex;
        }
    }

    /**
     * Removes an artifact. A failure is logged and left to the periodic sweep.
     *
     * @param path file to delete
     * @return {@code true} when a file was removed
     */
    public boolean delete(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.warn("Failed to delete {}, it will be retried by the sweep", path, ex);
            return false;
        }
    }

    /**
     * Deletes regular files last modified before {@code now - maxAge}.
     *
     * @param maxAge retention window
     * @param now    reference instant
     * @return number of deleted files
     */
    public int purgeOlderThan(Duration maxAge, Instant now) {
        Instant cutoff = now.minus(maxAge);
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(Files::isRegularFile).toList();
        } catch (IOException ex) {
            throw new ReportStorageException("Unable to list the report directory.", directory, ex);
        }

        int deleted = 0;
        for (Path file : files) {
            if (isOlderThan(file, cutoff) && delete(file)) {
                log.debug("Purged expired report file {}", file.getFileName());
                deleted++;
            }
        }
        return deleted;
    }

    private boolean isOlderThan(Path file, Instant cutoff) {
        try {
            return Files.getLastModifiedTime(file).toInstant().isBefore(cutoff);
        } catch (IOException ex) {
            // removed concurrently by its own task
            log.debug("Skipping {} during purge: {}", file, ex.getMessage());
            return false;
        }
    }

    /**
     * Producer of output bytes.
     */
    @FunctionalInterface
    public interface OutputWriter {
        void writeTo(OutputStream outputStream) throws IOException;
    }
}

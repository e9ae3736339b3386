package com.largomodo.photosheet.core.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Stages an export's output next to its final destination and cleans up on failure.
 * <p>
 * The document is written to a hidden staging file in the destination directory and only
 * moved over the destination by {@link #promote()}. Closing the workspace without promoting
 * deletes the staging file, so a failed run never leaves a partial document where the user
 * expects the result. Staging in the same directory keeps the final move on one filesystem,
 * which lets it be atomic.
 * <p>
 * An interrupted thread skips cleanup on close and leaves a warning instead, so shutdown is
 * never held up by file deletion.
 */
public class ExportWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExportWorkspace.class);

    private final Path destination;
    private final Path stagingFile;
    private boolean promoted;

    /**
     * Creates a workspace for one export.
     *
     * @param destination  final document path
     * @param uniqueSuffix suffix that keeps concurrent runs targeting one folder apart (e.g. run id)
     * @throws IOException if the destination directory cannot be created
     */
    public ExportWorkspace(Path destination, String uniqueSuffix) throws IOException {
        this.destination = destination.toAbsolutePath().normalize();
        Path directory = this.destination.getParent();
        Files.createDirectories(directory);
        this.stagingFile = directory.resolve("." + this.destination.getFileName() + "." + uniqueSuffix + ".tmp");
    }

    /**
     * File the document should be written to before promotion.
     */
    public Path getStagingFile() {
        return stagingFile;
    }

    public Path getDestination() {
        return destination;
    }

    /**
     * Replace the destination with the staging file.
     * <p>
     * Uses an atomic rename where the filesystem supports it, otherwise copies and then
     * deletes the staging file. Once promoted, the staging file is no longer deleted on close.
     *
     * @return the destination path
     * @throws IOException if the staging file cannot be moved or copied
     */
    public Path promote() throws IOException {
        if (Files.exists(destination)) {
            log.warn("Overwriting existing file: {}", destination);
        }

        try {
            Files.move(stagingFile, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, copying", destination);
            Files.copy(stagingFile, destination, StandardCopyOption.REPLACE_EXISTING);
            try {
                Files.delete(stagingFile);
            } catch (IOException leftover) {
                IOException failure = new IOException("Copied to " + destination
                        + " but could not remove staging file " + stagingFile, e);
                failure.addSuppressed(leftover);
                throw failure;
            }
        }

        promoted = true;
        return destination;
    }

    /**
     * Delete the staging file unless it was promoted.
     *
     * @throws CleanupException if the staging file exists and cannot be deleted
     */
    @Override
    public void close() throws CleanupException {
        if (promoted) {
            return;
        }
        // isInterrupted() keeps the flag for the caller
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Thread interrupted, leaving staging file in place: {}", stagingFile);
            return;
        }

        try {
            if (Files.deleteIfExists(stagingFile)) {
                log.debug("Discarded unfinished document: {}", stagingFile);
            }
        } catch (IOException e) {
            log.warn("Could not discard {}", stagingFile, e);
            throw new CleanupException("Discarding staged document for " + destination + " failed", List.of(e));
        }
    }
}

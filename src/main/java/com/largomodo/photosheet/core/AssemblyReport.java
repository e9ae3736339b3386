package com.largomodo.photosheet.core;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a persisted document.
 *
 * @param output       final document path
 * @param pageCount    pages written
 * @param failedPhotos photos rendered as error markers, in page order (unmodifiable)
 */
public record AssemblyReport(Path output, int pageCount, List<Path> failedPhotos) {

    public AssemblyReport {
        failedPhotos = List.copyOf(failedPhotos);
    }
}

package com.largomodo.photosheet.core;

import java.nio.file.Path;
import java.util.List;

/**
 * Terminal result of one export run.
 *
 * @param state          {@link ExportState#COMPLETED} or {@link ExportState#FAILED}
 * @param output         written document, null when failed
 * @param pageCount      pages written, 0 when failed
 * @param failedPhotos   photos shown as error markers (unmodifiable, empty when failed)
 * @param failureMessage human-readable reason, null when completed
 */
public record ExportOutcome(ExportState state, Path output, int pageCount, List<Path> failedPhotos,
                            String failureMessage) {

    public ExportOutcome {
        failedPhotos = List.copyOf(failedPhotos);
    }

    public static ExportOutcome completed(AssemblyReport report) {
        return new ExportOutcome(ExportState.COMPLETED, report.output(), report.pageCount(),
                report.failedPhotos(), null);
    }

    public static ExportOutcome failed(String failureMessage) {
        return new ExportOutcome(ExportState.FAILED, null, 0, List.of(), failureMessage);
    }

    public boolean isSuccess() {
        return state == ExportState.COMPLETED;
    }
}

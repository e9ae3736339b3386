package com.largomodo.photosheet.core;

import java.nio.file.Path;

/**
 * Observer interface for export lifecycle events.
 * <p>
 * Implementations can follow a run by receiving callbacks at key points: start, progress,
 * success and failure. All methods have default no-op implementations, allowing consumers
 * to override only the events they care about.
 * </p>
 * <p>
 * Callbacks of one run arrive one at a time and in order, on the executor given to the
 * {@link ExportOrchestrator}; progress values never decrease.
 * </p>
 * <p>
 * Example usage:
 * </p>
 * <pre>{@code
 * ExportListener listener = new ExportListener() {
 *     @Override
 *     public void onProgress(int percent) {
 *         progressBar.setValue(percent);
 *     }
 * };
 * }</pre>
 *
 * @see ExportOrchestrator
 */
public interface ExportListener {

    /**
     * Called when the run begins.
     *
     * @param photoCount number of photos in the snapshot being exported
     */
    default void onStart(int photoCount) {}

    /**
     * Called when overall progress advances.
     *
     * @param percent 0 to 100; the last call of a successful run reports 100
     */
    default void onProgress(int percent) {}

    /**
     * Called when the document has been written.
     *
     * @param output the written document
     */
    default void onSuccess(Path output) {}

    /**
     * Called when the run fails. The output path is left as it was before the run.
     *
     * @param message human-readable reason
     */
    default void onFailure(String message) {}
}

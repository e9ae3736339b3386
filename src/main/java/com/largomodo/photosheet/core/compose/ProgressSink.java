package com.largomodo.photosheet.core.compose;

/**
 * Receives per-photo progress from the compositor.
 */
@FunctionalInterface
public interface ProgressSink {

    ProgressSink NONE = (processed, total) -> {
    };

    /**
     * Called after every occupied cell, on the compositing thread.
     *
     * @param processed photos handled so far in this run, including failed ones
     * @param total     photos in this run
     */
    void onProgress(int processed, int total);
}

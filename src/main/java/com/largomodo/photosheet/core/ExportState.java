package com.largomodo.photosheet.core;

/**
 * Lifecycle of an {@link ExportOrchestrator}.
 * <p>
 * {@code IDLE -> RUNNING -> COMPLETED | FAILED}. A finished orchestrator may be started
 * again, which moves it back to {@code RUNNING}.
 */
public enum ExportState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}

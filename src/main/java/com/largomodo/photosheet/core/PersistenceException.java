package com.largomodo.photosheet.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The assembled document could not be written to its destination.
 * Terminal for the run; no partial document is left behind.
 */
public class PersistenceException extends IOException {

    private final Path target;

    public PersistenceException(Path target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}

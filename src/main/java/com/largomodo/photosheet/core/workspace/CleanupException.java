package com.largomodo.photosheet.core.workspace;

import java.io.IOException;
import java.util.List;

/**
 * A staging file could not be deleted when its workspace closed.
 * The deletion failure is attached as a suppressed exception.
 */
public class CleanupException extends RuntimeException {

    public CleanupException(String message, List<IOException> causes) {
        super(message);
        causes.forEach(this::addSuppressed);
    }
}

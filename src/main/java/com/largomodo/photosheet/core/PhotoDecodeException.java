package com.largomodo.photosheet.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A single photo could not be read or decoded.
 * <p>
 * Recoverable: the transform pipeline turns it into a failed placement, the compositor
 * marks the cell and the export continues.
 */
public class PhotoDecodeException extends IOException {

    private final Path photo;

    public PhotoDecodeException(Path photo, String message) {
        super(message);
        this.photo = photo;
    }

    public PhotoDecodeException(Path photo, String message, Throwable cause) {
        super(message, cause);
        this.photo = photo;
    }

    public Path getPhoto() {
        return photo;
    }
}

package com.largomodo.photosheet.collection;

import java.nio.file.Path;

/**
 * Immutable reference to one photo in an export: where it lives and how it is turned.
 * <p>
 * Entries never carry decoded pixels. The export engine re-reads {@code sourcePath} and
 * applies {@code rotation} every time it places the photo, so an entry can be shared
 * freely between a host's working set and a running export.
 *
 * @param sourcePath normalized absolute path of the original image file
 * @param rotation   clockwise rotation applied before any fitting
 */
public record PhotoEntry(Path sourcePath, Rotation rotation) {

    public PhotoEntry {
        if (sourcePath == null) {
            throw new IllegalArgumentException("sourcePath must not be null");
        }
        if (rotation == null) {
            throw new IllegalArgumentException("rotation must not be null");
        }
        sourcePath = sourcePath.toAbsolutePath().normalize();
    }

    /**
     * Creates an unrotated entry.
     */
    public static PhotoEntry of(Path sourcePath) {
        return new PhotoEntry(sourcePath, Rotation.R0);
    }

    /**
     * Returns a copy turned one further quarter turn clockwise.
     */
    public PhotoEntry rotated() {
        return new PhotoEntry(sourcePath, rotation.next());
    }

    public String fileName() {
        return sourcePath.getFileName().toString();
    }
}

package com.largomodo.photosheet.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Photo file detection for folder imports.
 * <p>
 * Recognizes JPEG and PNG by extension (case-insensitive) and rejects hidden files
 * (leading dot), which on macOS includes the "._" resource-fork companions that share
 * a photo's extension but hold no image data.
 * <p>
 * Stateless utility performing filesystem checks. Safe for concurrent use.
 */
public class PhotoMatcher {

    private static final Set<String> EXTENSIONS = Set.of(
            ".jpg", ".jpeg", ".png"
    );

    private PhotoMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * Check if path is a supported photo file.
     *
     * @param path File path to check (can be null)
     * @return true if path is a regular, non-hidden file with a supported extension
     */
    public static boolean isPhoto(Path path) {
        if (path == null || path.getFileName() == null) {
            return false;
        }

        if (!Files.isRegularFile(path)) {
            return false;
        }

        return hasPhotoName(path.getFileName().toString());
    }

    /**
     * Name-only check, no filesystem access.
     *
     * @param fileName bare file name
     * @return true if the name is not hidden and ends with a supported extension
     */
    public static boolean hasPhotoName(String fileName) {
        if (fileName == null || fileName.isEmpty() || fileName.startsWith(".")) {
            return false;
        }

        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String ext : EXTENSIONS) {
            if (lower.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}

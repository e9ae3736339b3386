package com.largomodo.photosheet.core.transform;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Outcome of placing one photo into one cell.
 * <p>
 * A successful placement carries the fitted bitmap and its offset from the cell's top-left
 * corner. A failed placement carries the photo path and a reason instead; the bitmap is
 * null and the offsets are zero.
 *
 * @param source  photo the placement was made for (null for in-memory images)
 * @param bitmap  fitted opaque RGB bitmap, null when failed
 * @param offsetX horizontal offset inside the cell, pixels
 * @param offsetY vertical offset inside the cell, pixels
 * @param failure human-readable failure reason, null when placed
 */
public record PlacementResult(Path source, BufferedImage bitmap, int offsetX, int offsetY, String failure) {

    public static PlacementResult placed(Path source, BufferedImage bitmap, int offsetX, int offsetY) {
        if (bitmap == null) {
            throw new IllegalArgumentException("bitmap must not be null for a successful placement");
        }
        return new PlacementResult(source, bitmap, offsetX, offsetY, null);
    }

    public static PlacementResult failed(Path source, String failure) {
        return new PlacementResult(source, null, 0, 0, failure == null ? "unknown error" : failure);
    }

    public boolean isFailed() {
        return failure != null;
    }

    public int width() {
        return bitmap == null ? 0 : bitmap.getWidth();
    }

    public int height() {
        return bitmap == null ? 0 : bitmap.getHeight();
    }
}

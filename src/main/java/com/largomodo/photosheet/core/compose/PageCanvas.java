package com.largomodo.photosheet.core.compose;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

/**
 * One composed page, ready to be encoded.
 *
 * @param pageIndex     zero-based page number
 * @param image         opaque RGB composite of the whole grid
 * @param occupiedCells number of cells that received a photo or an error marker
 * @param failedPhotos  photos whose cells show the error marker (unmodifiable)
 */
public record PageCanvas(int pageIndex, BufferedImage image, int occupiedCells, List<Path> failedPhotos) {

    public PageCanvas {
        failedPhotos = List.copyOf(failedPhotos);
    }
}

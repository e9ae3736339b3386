package com.largomodo.photosheet.core.transform;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * High-quality image resizing with Java2D.
 * <p>
 * A single bilinear or bicubic pass only samples a 2x2 or 4x4 neighbourhood, so large
 * reductions alias like nearest-neighbour. Downscaling therefore halves the image with
 * bilinear passes until it is within 2x of the target, then finishes with one bicubic
 * pass. Each halving averages every source pixel, which approximates an area filter.
 * Upscaling is a single bicubic pass.
 */
public final class Resampler {

    private Resampler() {
    }

    /**
     * Resize to exact dimensions.
     *
     * @param source       opaque RGB image
     * @param targetWidth  output width in pixels, at least 1
     * @param targetHeight output height in pixels, at least 1
     * @return a new {@code TYPE_INT_RGB} image, or {@code source} when no resize is needed
     */
    public static BufferedImage resize(BufferedImage source, int targetWidth, int targetHeight) {
        if (targetWidth < 1 || targetHeight < 1) {
            throw new IllegalArgumentException("Target size must be positive, got: "
                    + targetWidth + "x" + targetHeight);
        }
        if (source.getWidth() == targetWidth && source.getHeight() == targetHeight) {
            return source;
        }

        BufferedImage current = source;
        int width = source.getWidth();
        int height = source.getHeight();
        do {
            width = width > targetWidth ? Math.max(width / 2, targetWidth) : targetWidth;
            height = height > targetHeight ? Math.max(height / 2, targetHeight) : targetHeight;
            boolean lastPass = width == targetWidth && height == targetHeight;
            current = draw(current, width, height, lastPass
                    ? RenderingHints.VALUE_INTERPOLATION_BICUBIC
                    : RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        } while (width != targetWidth || height != targetHeight);

        return current;
    }

    private static BufferedImage draw(BufferedImage source, int width, int height, Object interpolation) {
        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, interpolation);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ALPHA_INTERPOLATION, RenderingHints.VALUE_ALPHA_INTERPOLATION_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }
}

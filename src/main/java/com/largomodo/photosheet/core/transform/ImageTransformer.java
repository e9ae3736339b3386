package com.largomodo.photosheet.core.transform;

import com.largomodo.photosheet.collection.Rotation;
import com.largomodo.photosheet.core.PhotoDecodeException;
import com.largomodo.photosheet.service.ImageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Turns a source photo into a bitmap fitted to a target cell.
 * <p>
 * Pipeline per photo:
 * <ol>
 *   <li>Decode through the {@link ImageCodec}</li>
 *   <li>Flatten onto opaque white (alpha, indexed and grayscale sources all become RGB)</li>
 *   <li>Size and crop according to the {@link FitPolicy}, computed on the rotated dimensions</li>
 *   <li>Rotate the fitted bitmap by whole quarter turns, remapping pixels without resampling</li>
 * </ol>
 * Fitting happens in the unrotated frame with swapped target axes, so only the cell-sized
 * bitmap is ever rotated. The result matches rotating first and fitting second.
 * <p>
 * Per-photo failures never escape {@link #place(Path, Rotation, int, int, FitPolicy)}:
 * they come back as a failed {@link PlacementResult}. That includes running out of heap
 * on an oversized photo.
 */
public class ImageTransformer {

    private static final Logger log = LoggerFactory.getLogger(ImageTransformer.class);

    private final ImageCodec codec;
    private final VerticalAlignment verticalAlignment;
    private final boolean allowUpscale;

    /**
     * @param codec             photo decoder
     * @param verticalAlignment letterbox vertical alignment
     * @param allowUpscale      whether letterboxing may enlarge photos smaller than the cell
     */
    public ImageTransformer(ImageCodec codec, VerticalAlignment verticalAlignment, boolean allowUpscale) {
        this.codec = codec;
        this.verticalAlignment = verticalAlignment;
        this.allowUpscale = allowUpscale;
    }

    /**
     * Decode, rotate and fit a photo file.
     *
     * @param source       photo file
     * @param rotation     clockwise rotation
     * @param targetWidth  cell width in pixels
     * @param targetHeight cell height in pixels (ignored by {@link FitPolicy#FIT_WIDTH_DYNAMIC})
     * @param policy       fit policy
     * @return placed bitmap with offset, or a failed result naming the photo
     */
    public PlacementResult place(Path source, Rotation rotation, int targetWidth, int targetHeight, FitPolicy policy) {
        try {
            BufferedImage decoded = codec.decode(source);
            return place(source, decoded, rotation, targetWidth, targetHeight, policy);
        } catch (PhotoDecodeException e) {
            log.debug("Decode failed for {}", source, e);
            return PlacementResult.failed(source, e.getMessage());
        } catch (OutOfMemoryError e) {
            // The decoded bitmap is unreachable here, so the heap is back for the next photo
            log.warn("Out of memory placing {}", source);
            return PlacementResult.failed(source, "Not enough memory to place " + source.getFileName());
        }
    }

    /**
     * Rotate and fit an already decoded image.
     *
     * @param source       photo the image came from, for reporting (may be null)
     * @param image        decoded image
     * @param rotation     clockwise rotation
     * @param targetWidth  cell width in pixels
     * @param targetHeight cell height in pixels (ignored by {@link FitPolicy#FIT_WIDTH_DYNAMIC})
     * @param policy       fit policy
     * @return placed bitmap with offset
     */
    public PlacementResult place(Path source, BufferedImage image, Rotation rotation,
                                 int targetWidth, int targetHeight, FitPolicy policy) {
        if (targetWidth < 1 || (policy != FitPolicy.FIT_WIDTH_DYNAMIC && targetHeight < 1)) {
            throw new IllegalArgumentException("Target cell must be positive, got: " + targetWidth + "x" + targetHeight);
        }

        BufferedImage opaque = toOpaqueRgb(image);

        return switch (policy) {
            case FILL_CROP -> fillCrop(source, opaque, rotation, targetWidth, targetHeight);
            case FIT_LETTERBOX -> letterbox(source, opaque, rotation, targetWidth, targetHeight);
            case FIT_WIDTH_DYNAMIC -> fitWidth(source, opaque, rotation, targetWidth);
        };
    }

    /**
     * Height a photo takes when scaled to {@code width}, after rotation, without decoding pixels.
     *
     * @throws PhotoDecodeException if the photo header cannot be read
     */
    public int measureHeightAtWidth(Path source, Rotation rotation, int width) throws PhotoDecodeException {
        Dimension size = codec.probe(source);
        int sourceWidth = rotation.swapsAxes() ? size.height : size.width;
        int sourceHeight = rotation.swapsAxes() ? size.width : size.height;
        return heightAtWidth(sourceWidth, sourceHeight, width);
    }

    static int heightAtWidth(int sourceWidth, int sourceHeight, int width) {
        if (sourceWidth < 1 || sourceHeight < 1) {
            throw new IllegalArgumentException("Image size must be positive, got: " + sourceWidth + "x" + sourceHeight);
        }
        return Math.max(1, (int) Math.round((double) sourceHeight * width / sourceWidth));
    }

    private PlacementResult fillCrop(Path source, BufferedImage image, Rotation rotation,
                                     int targetWidth, int targetHeight) {
        int rotatedWidth = rotatedWidth(image, rotation);
        int rotatedHeight = rotatedHeight(image, rotation);
        double scale = Math.max((double) targetWidth / rotatedWidth, (double) targetHeight / rotatedHeight);
        int scaledWidth = Math.max(targetWidth, (int) Math.round(rotatedWidth * scale));
        int scaledHeight = Math.max(targetHeight, (int) Math.round(rotatedHeight * scale));

        BufferedImage scaled = resizeUnrotated(image, rotation, scaledWidth, scaledHeight);
        int cropX = (scaledWidth - targetWidth) / 2;
        int cropY = (scaledHeight - targetHeight) / 2;
        BufferedImage cropped = cropUnrotated(scaled, rotation, cropX, cropY, targetWidth, targetHeight);
        return PlacementResult.placed(source, rotate(cropped, rotation), 0, 0);
    }

    private PlacementResult letterbox(Path source, BufferedImage image, Rotation rotation,
                                      int targetWidth, int targetHeight) {
        int rotatedWidth = rotatedWidth(image, rotation);
        int rotatedHeight = rotatedHeight(image, rotation);
        double scale = Math.min((double) targetWidth / rotatedWidth, (double) targetHeight / rotatedHeight);
        if (!allowUpscale) {
            scale = Math.min(scale, 1.0);
        }
        // Rounding (not flooring) lets the binding axis land exactly on the cell edge
        int width = clamp((int) Math.round(rotatedWidth * scale), targetWidth);
        int height = clamp((int) Math.round(rotatedHeight * scale), targetHeight);

        BufferedImage scaled = rotate(resizeUnrotated(image, rotation, width, height), rotation);
        int offsetX = (targetWidth - width) / 2;
        int offsetY = verticalAlignment.offset(targetHeight, height);
        return PlacementResult.placed(source, scaled, offsetX, offsetY);
    }

    private PlacementResult fitWidth(Path source, BufferedImage image, Rotation rotation, int targetWidth) {
        int height = heightAtWidth(rotatedWidth(image, rotation), rotatedHeight(image, rotation), targetWidth);
        BufferedImage scaled = rotate(resizeUnrotated(image, rotation, targetWidth, height), rotation);
        return PlacementResult.placed(source, scaled, 0, 0);
    }

    private static int rotatedWidth(BufferedImage image, Rotation rotation) {
        return rotation.swapsAxes() ? image.getHeight() : image.getWidth();
    }

    private static int rotatedHeight(BufferedImage image, Rotation rotation) {
        return rotation.swapsAxes() ? image.getWidth() : image.getHeight();
    }

    /**
     * Resize so that the result, once rotated, is {@code width x height}.
     */
    private static BufferedImage resizeUnrotated(BufferedImage image, Rotation rotation, int width, int height) {
        return rotation.swapsAxes()
                ? Resampler.resize(image, height, width)
                : Resampler.resize(image, width, height);
    }

    /**
     * Crop the region of an unrotated image that lands on {@code (x, y, width, height)} after rotation.
     */
    private static BufferedImage cropUnrotated(BufferedImage image, Rotation rotation, int x, int y, int width, int height) {
        int w = image.getWidth();
        int h = image.getHeight();
        return switch (rotation) {
            case R0 -> image.getSubimage(x, y, width, height);
            case R90 -> image.getSubimage(y, h - x - width, height, width);
            case R180 -> image.getSubimage(w - x - width, h - y - height, width, height);
            case R270 -> image.getSubimage(w - y - height, x, height, width);
        };
    }

    private static int clamp(int value, int max) {
        return Math.max(1, Math.min(value, max));
    }

    /**
     * Composite an image onto opaque white, producing {@code TYPE_INT_RGB}.
     * Images that are already opaque RGB are returned unchanged.
     */
    public static BufferedImage toOpaqueRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    /**
     * Lossless clockwise rotation by whole quarter turns.
     *
     * @param image    opaque RGB image
     * @param rotation rotation to apply
     * @return rotated image; {@code image} itself for {@link Rotation#R0}
     */
    public static BufferedImage rotate(BufferedImage image, Rotation rotation) {
        if (rotation == Rotation.R0) {
            return image;
        }
        int width = image.getWidth();
        int height = image.getHeight();
        int targetWidth = rotation.swapsAxes() ? height : width;
        int targetHeight = rotation.swapsAxes() ? width : height;

        int[] in = image.getRGB(0, 0, width, height, null, 0, width);
        int[] out = new int[in.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int tx;
                int ty;
                switch (rotation) {
                    case R90 -> {
                        tx = height - 1 - y;
                        ty = x;
                    }
                    case R180 -> {
                        tx = width - 1 - x;
                        ty = height - 1 - y;
                    }
                    default -> {
                        tx = y;
                        ty = width - 1 - x;
                    }
                }
                out[ty * targetWidth + tx] = in[y * width + x];
            }
        }

        BufferedImage rotated = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        rotated.setRGB(0, 0, targetWidth, targetHeight, out, 0, targetWidth);
        return rotated;
    }
}

package com.largomodo.photosheet.service;

import com.largomodo.photosheet.core.PhotoDecodeException;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Service interface for reading photos and encoding composites.
 * <p>
 * <b>Contract Guarantees:</b>
 * <ul>
 *   <li>Source files are only read, never modified</li>
 *   <li>Every per-photo failure (missing, unreadable, unsupported, corrupt) surfaces as
 *       {@link PhotoDecodeException} carrying the offending path</li>
 *   <li>Dimensions returned by {@link #probe(Path)} equal those of {@link #decode(Path)}
 *       for the same file</li>
 * </ul>
 */
public interface ImageCodec {

    /**
     * Decode a photo into pixels, ignoring any embedded orientation metadata.
     *
     * @param source photo file
     * @return decoded image (any pixel layout)
     * @throws PhotoDecodeException if the file cannot be read or decoded
     */
    BufferedImage decode(Path source) throws PhotoDecodeException;

    /**
     * Read a photo's pixel dimensions without decoding its pixels.
     *
     * @param source photo file
     * @return width and height in pixels, unrotated
     * @throws PhotoDecodeException if the file cannot be read or its header is not understood
     */
    Dimension probe(Path source) throws PhotoDecodeException;

    /**
     * Encode an opaque image as baseline JPEG.
     *
     * @param image   opaque RGB image
     * @param quality compression quality in (0, 1]
     * @return JPEG bytes
     * @throws IOException if encoding fails
     */
    byte[] encodeJpeg(BufferedImage image, float quality) throws IOException;
}

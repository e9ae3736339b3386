package com.largomodo.photosheet.service;

import com.largomodo.photosheet.core.PhotoDecodeException;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * {@link ImageCodec} backed by the JDK's Image I/O plugins (JPEG, PNG, GIF, BMP).
 * <p>
 * Stateless; each call opens its own streams and readers, so one instance is safe to
 * share across threads.
 */
public class ImageIoCodec implements ImageCodec {

    static {
        // Disk cache only slows down in-memory encode/decode of single photos
        ImageIO.setUseCache(false);
    }

    @Override
    public BufferedImage decode(Path source) throws PhotoDecodeException {
        requireReadable(source);
        BufferedImage image;
        try {
            image = ImageIO.read(source.toFile());
        } catch (IOException e) {
            throw new PhotoDecodeException(source, "Cannot decode photo " + source + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Corrupt streams make some decoders fail with unchecked exceptions
            throw new PhotoDecodeException(source, "Corrupt photo " + source + ": " + e, e);
        }
        if (image == null) {
            throw new PhotoDecodeException(source, "Unsupported image format: " + source);
        }
        return image;
    }

    @Override
    public Dimension probe(Path source) throws PhotoDecodeException {
        requireReadable(source);
        try (ImageInputStream in = ImageIO.createImageInputStream(source.toFile())) {
            if (in == null) {
                throw new PhotoDecodeException(source, "Cannot open photo " + source);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new PhotoDecodeException(source, "Unsupported image format: " + source);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return new Dimension(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        } catch (PhotoDecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new PhotoDecodeException(source, "Cannot read photo header " + source + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new PhotoDecodeException(source, "Corrupt photo header " + source + ": " + e, e);
        }
    }

    @Override
    public byte[] encodeJpeg(BufferedImage image, float quality) throws IOException {
        if (image.getColorModel().hasAlpha()) {
            throw new IllegalArgumentException("JPEG encoding requires an opaque image");
        }
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG encoder available");
        }
        ImageWriter writer = writers.next();
        try (ByteArrayOutputStream bytes = new ByteArrayOutputStream();
             ImageOutputStream out = ImageIO.createImageOutputStream(bytes)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);

            writer.setOutput(out);
            writer.write(null, new IIOImage(image, null, null), param);
            out.flush();
            return bytes.toByteArray();
        } finally {
            writer.dispose();
        }
    }

    private static void requireReadable(Path source) throws PhotoDecodeException {
        if (!Files.isRegularFile(source)) {
            throw new PhotoDecodeException(source, "Photo does not exist: " + source);
        }
        if (!Files.isReadable(source)) {
            throw new PhotoDecodeException(source, "Photo is not readable (check permissions): " + source);
        }
    }
}

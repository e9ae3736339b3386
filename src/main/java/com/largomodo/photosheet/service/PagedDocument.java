package com.largomodo.photosheet.service;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * An open document being built page by page.
 * <p>
 * <b>Contract Guarantees:</b>
 * <ul>
 *   <li>Content is appended in call order</li>
 *   <li>A page break applies to the next embedded image, which then starts a new page</li>
 *   <li>Images are embedded centered at the requested physical size, independent of their pixel density</li>
 *   <li>Nothing reaches the filesystem before {@link #save(Path)}</li>
 * </ul>
 */
public interface PagedDocument extends Closeable {

    /**
     * Force the next embedded image onto a new page.
     */
    void addPageBreak();

    /**
     * Append a centered JPEG image at a physical size.
     *
     * @param jpeg     encoded JPEG bytes
     * @param widthMm  displayed width in millimetres
     * @param heightMm displayed height in millimetres
     * @throws IOException if the image cannot be embedded
     */
    void embedImage(byte[] jpeg, double widthMm, double heightMm) throws IOException;

    /**
     * Number of images embedded so far.
     */
    int imageCount();

    /**
     * Write the document to a file, replacing any existing file.
     *
     * @param target destination file
     * @throws IOException if writing fails
     */
    void save(Path target) throws IOException;
}

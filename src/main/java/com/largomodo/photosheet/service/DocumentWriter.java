package com.largomodo.photosheet.service;

import com.largomodo.photosheet.core.layout.PaperSize;

import java.io.IOException;

/**
 * Service interface for creating paginated documents that hold one image per page.
 * <p>
 * Abstracts the document container so the assembler never touches a file format.
 * Primary use cases:
 * <ul>
 *   <li>Production: Word (.docx) documents via Apache POI</li>
 *   <li>Testing: mock documents to verify page break and embed order</li>
 * </ul>
 */
public interface DocumentWriter {

    /**
     * Start a new, empty document.
     *
     * @param paper    page size used by every page
     * @param marginMm page margin on every side, millimetres
     * @return open document; the caller closes it
     * @throws IOException if the document cannot be created
     */
    PagedDocument create(PaperSize paper, double marginMm) throws IOException;
}

package com.largomodo.photosheet.core;

import com.largomodo.photosheet.core.compose.PageCanvas;
import com.largomodo.photosheet.core.layout.PageLayout;
import com.largomodo.photosheet.core.workspace.ExportWorkspace;
import com.largomodo.photosheet.service.DocumentWriter;
import com.largomodo.photosheet.service.ImageCodec;
import com.largomodo.photosheet.service.PagedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

/**
 * Appends composed pages to a new document and persists it.
 * <p>
 * Pipeline:
 * 1. Open a staging workspace next to the destination and a new document
 * 2. For every page: page break (all but the first), JPEG-encode, embed at physical canvas size
 * 3. Check one embedded image per page
 * 4. Save to the staging file, then promote it over the destination
 * <p>
 * Nothing is written to the destination until every page is appended. Any failure,
 * including one thrown by the page iterator, closes the workspace without promoting and the
 * staging file is deleted.
 */
public class DocumentAssembler {

    private static final Logger log = LoggerFactory.getLogger(DocumentAssembler.class);

    private final DocumentWriter writer;
    private final ImageCodec codec;

    public DocumentAssembler(DocumentWriter writer, ImageCodec codec) {
        this.writer = writer;
        this.codec = codec;
    }

    /**
     * Assemble and persist all pages.
     *
     * @param pages  composed pages in order; consumed lazily
     * @param layout run geometry, supplies the physical embed size
     * @param config run settings (paper, margin, JPEG quality, output path)
     * @return what was written
     * @throws PersistenceException if the document cannot be saved to its destination
     * @throws IOException          if a page cannot be encoded or embedded, or a page lost its image
     */
    public AssemblyReport assemble(Iterator<PageCanvas> pages, PageLayout layout, ExportConfiguration config)
            throws IOException {
        Path output = config.outputPath();
        ExportWorkspace workspace = openWorkspace(output);

        try (workspace; PagedDocument document = writer.create(config.paperSize(), config.pageMarginMm())) {
            int pageCount = 0;
            List<Path> failedPhotos = new ArrayList<>();

            while (pages.hasNext()) {
                PageCanvas page = pages.next();
                if (pageCount > 0) {
                    document.addPageBreak();
                }
                byte[] jpeg = codec.encodeJpeg(page.image(), config.jpegQuality());
                document.embedImage(jpeg, layout.canvasWidthMm(), layout.canvasHeightMm());
                failedPhotos.addAll(page.failedPhotos());
                pageCount++;
                log.debug("Appended page {} ({} KB)", pageCount, jpeg.length / 1024);
            }

            if (document.imageCount() != pageCount) {
                throw new IOException("Document holds " + document.imageCount() + " image(s) for "
                        + pageCount + " page(s)");
            }

            Path written;
            try {
                document.save(workspace.getStagingFile());
                written = workspace.promote();
            } catch (IOException e) {
                throw new PersistenceException(output, "Cannot save document to " + output + ": " + e.getMessage(), e);
            }

            log.info("Saved {} page(s) to {}", pageCount, written);
            return new AssemblyReport(written, pageCount, failedPhotos);
        }
    }

    private static ExportWorkspace openWorkspace(Path output) throws PersistenceException {
        try {
            return new ExportWorkspace(output, UUID.randomUUID().toString());
        } catch (IOException e) {
            throw new PersistenceException(output, "Cannot prepare output directory for " + output + ": " + e.getMessage(), e);
        }
    }
}

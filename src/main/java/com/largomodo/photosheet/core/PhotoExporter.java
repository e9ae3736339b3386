package com.largomodo.photosheet.core;

import com.largomodo.photosheet.collection.PhotoEntry;
import com.largomodo.photosheet.core.compose.PageCanvas;
import com.largomodo.photosheet.core.compose.PageCompositor;
import com.largomodo.photosheet.core.compose.PagePacker;
import com.largomodo.photosheet.core.compose.ProgressSink;
import com.largomodo.photosheet.core.layout.LayoutCalculator;
import com.largomodo.photosheet.core.layout.PageLayout;
import com.largomodo.photosheet.core.transform.ImageTransformer;
import com.largomodo.photosheet.service.DocumentWriter;
import com.largomodo.photosheet.service.ImageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/**
 * Photo list to document export pipeline.
 * <p>
 * Coordinates the synchronous workflow of one run:
 * 1. Compute the page layout once (fails fast on a bad configuration)
 * 2. Compose pages lazily, one canvas in memory at a time
 * 3. Append every page to the document and persist it
 * <p>
 * Uses dependency injection for all collaborators (codec, writer, packer), which lets
 * tests replace any of them.
 */
public class PhotoExporter {

    private static final Logger log = LoggerFactory.getLogger(PhotoExporter.class);

    private final ImageCodec codec;
    private final PagePacker packer;
    private final DocumentAssembler assembler;

    /**
     * @param codec  photo decoder and JPEG encoder
     * @param writer document builder
     * @param packer page distribution strategy
     */
    public PhotoExporter(ImageCodec codec, DocumentWriter writer, PagePacker packer) {
        if (codec == null || writer == null || packer == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.codec = codec;
        this.packer = packer;
        this.assembler = new DocumentAssembler(writer, codec);
    }

    /**
     * Export photos to the configured output document.
     *
     * @param photos   photos in cell order, at least one
     * @param config   run settings
     * @param progress receives {@code (processed, total)} after each photo
     * @return what was written
     * @throws ConfigurationException     if the photo list is empty or the layout is impossible
     * @throws CanvasAllocationException  if a page canvas cannot be allocated
     * @throws PersistenceException       if the document cannot be saved
     * @throws IOException                if a page cannot be encoded or embedded
     */
    public AssemblyReport export(List<PhotoEntry> photos, ExportConfiguration config, ProgressSink progress)
            throws IOException {
        if (photos.isEmpty()) {
            throw new ConfigurationException("No photos to export");
        }

        PageLayout layout = LayoutCalculator.compute(config);
        log.info("Exporting {} photo(s) to {} page(s) [{} per page, {}]",
                photos.size(), config.density().pagesFor(photos.size()),
                config.density().getPhotosPerPage(), config.fitPolicy());
        log.debug("Layout: cell {}x{}px, gap {}px, canvas {}x{}px ({} x {} mm)",
                layout.cellWidthPx(), layout.cellHeightPx(), layout.gapPx(),
                layout.canvasWidthPx(), layout.canvasHeightPx(),
                layout.canvasWidthMm(), layout.canvasHeightMm());

        ImageTransformer transformer = new ImageTransformer(codec, config.verticalAlignment(), config.allowUpscale());
        PageCompositor compositor = new PageCompositor(transformer, packer);
        Iterator<PageCanvas> pages = compositor.compose(photos, layout, config.fitPolicy(), progress);

        AssemblyReport report = assembler.assemble(pages, layout, config);
        if (!report.failedPhotos().isEmpty()) {
            log.warn("{} photo(s) could not be read and are marked in the document", report.failedPhotos().size());
        }
        return report;
    }
}

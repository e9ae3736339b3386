package com.largomodo.photosheet.core.compose;

import com.largomodo.photosheet.collection.PhotoEntry;
import com.largomodo.photosheet.core.CanvasAllocationException;
import com.largomodo.photosheet.core.PhotoDecodeException;
import com.largomodo.photosheet.core.layout.PageLayout;
import com.largomodo.photosheet.core.transform.FitPolicy;
import com.largomodo.photosheet.core.transform.ImageTransformer;
import com.largomodo.photosheet.core.transform.PlacementResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Paints photos onto page-sized canvases, one page at a time.
 * <p>
 * Cell origins follow the layout's convention of gaps between cells only:
 * {@code x = col * (cellWidth + gap)}, {@code y = row * (cellHeight + gap)}.
 * <p>
 * {@link FitPolicy#FIT_WIDTH_DYNAMIC} is composed in two passes. The first measures every
 * photo's height at the cell width from its header alone; each row takes the tallest height
 * in it. If those rows and their gaps do not fit the canvas, every row and width is shrunk by
 * one common factor. The second pass places photos at the top of their row, centered
 * horizontally. A photo whose header cannot be read is measured as one fixed cell height.
 * <p>
 * A photo that cannot be decoded gets an {@link ErrorMarker} in its cell and is listed on the
 * page; composition continues. Only a canvas that cannot be allocated stops the run.
 */
public class PageCompositor {

    private static final Logger log = LoggerFactory.getLogger(PageCompositor.class);

    static final String MDC_PHOTO = "photo";

    private final ImageTransformer transformer;
    private final PagePacker packer;

    public PageCompositor(ImageTransformer transformer, PagePacker packer) {
        this.transformer = transformer;
        this.packer = packer;
    }

    /**
     * Compose pages lazily.
     * <p>
     * Each call to {@code next()} paints one page; only the page being returned is held by the
     * compositor. Iterating again requires a new call.
     *
     * @param photos   photos in cell order
     * @param layout   geometry of the run
     * @param policy   fit policy for every cell
     * @param progress receives {@code (processed, total)} after each photo
     * @return iterator over {@code ceil(photos / photosPerPage)} pages
     */
    public Iterator<PageCanvas> compose(List<PhotoEntry> photos, PageLayout layout, FitPolicy policy,
                                        ProgressSink progress) {
        List<PageSlice> slices = packer.pack(photos, layout.photosPerPage());
        return new PageIterator(slices, photos.size(), layout, policy, progress);
    }

    /**
     * Paint a single page.
     *
     * @param processedBefore photos already handled in earlier pages, for progress reporting
     */
    PageCanvas composePage(PageSlice slice, PageLayout layout, FitPolicy policy,
                           int processedBefore, int total, ProgressSink progress) {
        BufferedImage canvas = allocateCanvas(layout);
        List<Path> failures = new ArrayList<>();

        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, canvas.getWidth(), canvas.getHeight());

            RowGeometry rows = policy == FitPolicy.FIT_WIDTH_DYNAMIC
                    ? measureRows(slice, layout)
                    : RowGeometry.fixed(layout);

            List<PhotoEntry> photos = slice.photos();
            for (int i = 0; i < photos.size(); i++) {
                PhotoEntry photo = photos.get(i);
                int row = i / layout.columns();
                int col = i % layout.columns();
                int x = layout.cellX(col);
                int y = rows.top(row);
                int rowHeight = rows.heights[row];

                MDC.put(MDC_PHOTO, photo.fileName());
                try {
                    PlacementResult result = place(photo, layout, rows, rowHeight, policy);
                    if (result.isFailed()) {
                        log.warn("Cannot place {}: {}", photo.sourcePath(), result.failure());
                        ErrorMarker.paint(g, x, y, layout.cellWidthPx(), rowHeight);
                        failures.add(photo.sourcePath());
                    } else {
                        paint(g, result, x, y, layout.cellWidthPx(), rowHeight);
                    }
                } finally {
                    MDC.remove(MDC_PHOTO);
                }
                progress.onProgress(processedBefore + i + 1, total);
            }
        } finally {
            g.dispose();
        }

        log.debug("Composed page {} with {} photo(s), {} failed",
                slice.pageIndex() + 1, slice.photos().size(), failures.size());
        return new PageCanvas(slice.pageIndex(), canvas, slice.photos().size(), failures);
    }

    private PlacementResult place(PhotoEntry photo, PageLayout layout, RowGeometry rows, int rowHeight,
                                  FitPolicy policy) {
        if (policy != FitPolicy.FIT_WIDTH_DYNAMIC) {
            return transformer.place(photo.sourcePath(), photo.rotation(),
                    layout.cellWidthPx(), layout.cellHeightPx(), policy);
        }
        int width = rows.contentWidth;
        PlacementResult placed = transformer.place(photo.sourcePath(), photo.rotation(), width, rowHeight, policy);
        if (placed.isFailed()) {
            return placed;
        }
        return PlacementResult.placed(placed.source(), placed.bitmap(),
                (layout.cellWidthPx() - placed.width()) / 2, 0);
    }

    private static void paint(Graphics2D g, PlacementResult result, int cellX, int cellY,
                              int cellWidth, int cellHeight) {
        Graphics2D cell = (Graphics2D) g.create();
        try {
            // Rounding differences must never spill into a neighbouring cell
            cell.clipRect(cellX, cellY, cellWidth, cellHeight);
            cell.drawImage(result.bitmap(), cellX + result.offsetX(), cellY + result.offsetY(), null);
        } finally {
            cell.dispose();
        }
    }

    private RowGeometry measureRows(PageSlice slice, PageLayout layout) {
        int[] heights = new int[layout.rows()];
        List<PhotoEntry> photos = slice.photos();
        for (int i = 0; i < photos.size(); i++) {
            PhotoEntry photo = photos.get(i);
            int row = i / layout.columns();
            int height;
            try {
                height = transformer.measureHeightAtWidth(photo.sourcePath(), photo.rotation(), layout.cellWidthPx());
            } catch (PhotoDecodeException e) {
                log.debug("Cannot measure {}, reserving one cell height", photo.sourcePath(), e);
                height = layout.cellHeightPx();
            }
            heights[row] = Math.max(heights[row], height);
        }

        int usedRows = (photos.size() + layout.columns() - 1) / layout.columns();
        long contentHeight = 0;
        for (int r = 0; r < usedRows; r++) {
            contentHeight += heights[r];
        }
        long available = layout.canvasHeightPx() - (long) layout.gapPx() * (usedRows - 1);
        if (contentHeight <= available) {
            return new RowGeometry(heights, layout.gapPx(), layout.cellWidthPx());
        }

        double shrink = (double) available / contentHeight;
        for (int r = 0; r < usedRows; r++) {
            heights[r] = Math.max(1, (int) Math.floor(heights[r] * shrink));
        }
        int width = Math.max(1, (int) Math.floor(layout.cellWidthPx() * shrink));
        log.debug("Rows overflow page {} by {}px, shrinking by {}",
                slice.pageIndex() + 1, contentHeight - available, shrink);
        return new RowGeometry(heights, layout.gapPx(), width);
    }

    private static BufferedImage allocateCanvas(PageLayout layout) {
        int width = layout.canvasWidthPx();
        int height = layout.canvasHeightPx();
        if (width < 1 || height < 1) {
            throw new CanvasAllocationException("Canvas size must be positive, got: " + width + "x" + height);
        }
        try {
            return new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        } catch (IllegalArgumentException | NegativeArraySizeException | OutOfMemoryError e) {
            throw new CanvasAllocationException("Cannot allocate " + width + "x" + height + " page canvas", e);
        }
    }

    /**
     * Row heights and the content width used for every cell on one page.
     */
    private static final class RowGeometry {
        private final int[] heights;
        private final int gap;
        private final int contentWidth;

        private RowGeometry(int[] heights, int gap, int contentWidth) {
            this.heights = heights;
            this.gap = gap;
            this.contentWidth = contentWidth;
        }

        static RowGeometry fixed(PageLayout layout) {
            int[] heights = new int[layout.rows()];
            Arrays.fill(heights, layout.cellHeightPx());
            return new RowGeometry(heights, layout.gapPx(), layout.cellWidthPx());
        }

        int top(int row) {
            int y = 0;
            for (int r = 0; r < row; r++) {
                y += heights[r] + gap;
            }
            return y;
        }
    }

    private final class PageIterator implements Iterator<PageCanvas> {
        private final List<PageSlice> slices;
        private final int total;
        private final PageLayout layout;
        private final FitPolicy policy;
        private final ProgressSink progress;
        private int nextSlice;
        private int processed;

        private PageIterator(List<PageSlice> slices, int total, PageLayout layout, FitPolicy policy,
                             ProgressSink progress) {
            this.slices = slices;
            this.total = total;
            this.layout = layout;
            this.policy = policy;
            this.progress = progress;
        }

        @Override
        public boolean hasNext() {
            return nextSlice < slices.size();
        }

        @Override
        public PageCanvas next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more pages");
            }
            PageSlice slice = slices.get(nextSlice++);
            PageCanvas page = composePage(slice, layout, policy, processed, total, progress);
            processed += slice.photos().size();
            return page;
        }
    }
}

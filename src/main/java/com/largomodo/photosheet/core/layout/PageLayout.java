package com.largomodo.photosheet.core.layout;

/**
 * Derived geometry of one export run: grid, cell, gap and canvas sizes in millimetres and pixels.
 * <p>
 * The composite canvas holds exactly the grid content with gaps between cells and none
 * around the edges, so {@code canvasWidthPx == columns * cellWidthPx + (columns - 1) * gapPx}
 * (likewise for height). Millimetre values drive the embed size in the document, pixel
 * values drive rasterization.
 *
 * @param columns         grid columns
 * @param rows            grid rows
 * @param cellWidthMm     image budget per cell, after the size factor
 * @param cellHeightMm    image budget per cell, after the size factor
 * @param gapMm           spacing between neighbouring cells (never scaled)
 * @param canvasWidthMm   physical width of the composite
 * @param canvasHeightMm  physical height of the composite
 * @param pixelsPerMm     rasterization density
 * @param cellWidthPx     cell width in pixels (rounded down)
 * @param cellHeightPx    cell height in pixels (rounded down)
 * @param gapPx           gap in pixels (rounded down)
 * @param canvasWidthPx   composite width in pixels
 * @param canvasHeightPx  composite height in pixels
 */
public record PageLayout(int columns, int rows,
                         double cellWidthMm, double cellHeightMm, double gapMm,
                         double canvasWidthMm, double canvasHeightMm,
                         double pixelsPerMm,
                         int cellWidthPx, int cellHeightPx, int gapPx,
                         int canvasWidthPx, int canvasHeightPx) {

    public int photosPerPage() {
        return columns * rows;
    }

    /**
     * Left edge of a column on the canvas, in pixels.
     */
    public int cellX(int column) {
        return column * (cellWidthPx + gapPx);
    }

    /**
     * Top edge of a row on the canvas when rows have the fixed cell height, in pixels.
     */
    public int cellY(int row) {
        return row * (cellHeightPx + gapPx);
    }
}

package com.largomodo.photosheet.core.layout;

import com.largomodo.photosheet.core.ConfigurationException;
import com.largomodo.photosheet.core.ExportConfiguration;

/**
 * Computes cell and canvas geometry for a grid on a page.
 * <p>
 * Steps per axis, with {@code n} the column (or row) count:
 * <ol>
 *   <li>usable = paper - 2 * margin</li>
 *   <li>rawCell = (usable - gap * (n - 1)) / n</li>
 *   <li>cell = rawCell * sizeFactor (the gap is never scaled)</li>
 *   <li>canvas = n * cell + gap * (n - 1)</li>
 * </ol>
 * Pixel cell and gap sizes are rounded down and the pixel canvas is summed from them,
 * so rounding never accumulates past the usable area. The physical canvas is the pixel
 * canvas converted back to millimetres, which keeps the embedded page an exact uniform scale
 * of its bitmap.
 * <p>
 * Pure and stateless.
 */
public final class LayoutCalculator {

    private static final double MM_PER_INCH = 25.4;

    private LayoutCalculator() {
    }

    /**
     * Layout for an export configuration.
     *
     * @throws ConfigurationException if the configuration cannot produce a positive layout
     */
    public static PageLayout compute(ExportConfiguration config) {
        return compute(config.paperSize(), config.pageMarginMm(), config.gapMm(),
                config.density(), config.sizeFactor(), config.dpi());
    }

    /**
     * Computes the page layout.
     *
     * @param paper      physical page size
     * @param marginMm   page margin on every side, millimetres
     * @param gapMm      spacing between cells, millimetres
     * @param density    grid density
     * @param sizeFactor fraction of the nominal cell used by image content, in (0, 1]
     * @param dpi        rasterization resolution in pixels per inch
     * @return derived layout
     * @throws ConfigurationException if any input is invalid or a derived size is not positive
     */
    public static PageLayout compute(PaperSize paper, double marginMm, double gapMm,
                                     GridDensity density, double sizeFactor, int dpi) {
        if (paper == null) {
            throw new ConfigurationException("Paper size must be specified");
        }
        if (density == null) {
            throw new ConfigurationException("Grid density must be specified");
        }
        // Negated comparisons also reject NaN
        if (!(sizeFactor > 0.0 && sizeFactor <= 1.0)) {
            throw new ConfigurationException("Size factor must be in (0, 1], got: " + sizeFactor);
        }
        if (!(marginMm >= 0.0) || Double.isInfinite(marginMm)) {
            throw new ConfigurationException("Page margin must be a non-negative length, got: " + marginMm);
        }
        if (!(gapMm >= 0.0) || Double.isInfinite(gapMm)) {
            throw new ConfigurationException("Gap must be a non-negative length, got: " + gapMm);
        }
        if (dpi <= 0) {
            throw new ConfigurationException("Resolution must be positive, got: " + dpi + " dpi");
        }

        int columns = density.getColumns();
        int rows = density.getRows();

        double usableWidthMm = paper.getWidthMm() - 2 * marginMm;
        double usableHeightMm = paper.getHeightMm() - 2 * marginMm;
        if (usableWidthMm <= 0 || usableHeightMm <= 0) {
            throw new ConfigurationException("Page margin " + marginMm + " mm leaves no usable area on " + paper);
        }

        double rawCellWidthMm = (usableWidthMm - gapMm * (columns - 1)) / columns;
        double rawCellHeightMm = (usableHeightMm - gapMm * (rows - 1)) / rows;
        if (rawCellWidthMm <= 0 || rawCellHeightMm <= 0) {
            throw new ConfigurationException("Gap " + gapMm + " mm leaves no room for a "
                    + columns + "x" + rows + " grid");
        }

        double cellWidthMm = rawCellWidthMm * sizeFactor;
        double cellHeightMm = rawCellHeightMm * sizeFactor;

        double pixelsPerMm = dpi / MM_PER_INCH;
        int cellWidthPx = (int) Math.floor(cellWidthMm * pixelsPerMm);
        int cellHeightPx = (int) Math.floor(cellHeightMm * pixelsPerMm);
        int gapPx = (int) Math.floor(gapMm * pixelsPerMm);
        if (cellWidthPx < 1 || cellHeightPx < 1) {
            throw new ConfigurationException("Cell size " + cellWidthPx + "x" + cellHeightPx
                    + " px is not positive at " + dpi + " dpi");
        }

        int canvasWidthPx = columns * cellWidthPx + (columns - 1) * gapPx;
        int canvasHeightPx = rows * cellHeightPx + (rows - 1) * gapPx;
        // Embed size follows the rasterized canvas so both axes scale alike; min() absorbs residue
        double canvasWidthMm = Math.min(usableWidthMm, canvasWidthPx / pixelsPerMm);
        double canvasHeightMm = Math.min(usableHeightMm, canvasHeightPx / pixelsPerMm);

        return new PageLayout(columns, rows,
                cellWidthMm, cellHeightMm, gapMm,
                canvasWidthMm, canvasHeightMm,
                pixelsPerMm,
                cellWidthPx, cellHeightPx, gapPx,
                canvasWidthPx, canvasHeightPx);
    }
}

package com.largomodo.photosheet.core.layout;

import com.largomodo.photosheet.core.ConfigurationException;

/**
 * Supported photos-per-page choices, each bound to a fixed grid.
 * <p>
 * Grids are portrait-oriented: for six photos the page gets two columns and three rows,
 * which keeps landscape and portrait cells close to the 3:2 photo aspect on A4.
 */
public enum GridDensity {
    FOUR(4, 2, 2),
    SIX(6, 2, 3),
    NINE(9, 3, 3);

    private final int photosPerPage;
    private final int columns;
    private final int rows;

    GridDensity(int photosPerPage, int columns, int rows) {
        this.photosPerPage = photosPerPage;
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Resolves the grid for a photos-per-page count.
     *
     * @param photosPerPage requested photos per page
     * @return matching grid density
     * @throws ConfigurationException if the count is not 4, 6 or 9
     */
    public static GridDensity fromPhotosPerPage(int photosPerPage) {
        for (GridDensity density : values()) {
            if (density.photosPerPage == photosPerPage) {
                return density;
            }
        }
        throw new ConfigurationException("Unsupported photos per page: " + photosPerPage + ". Supported: 4, 6, 9");
    }

    /**
     * Number of pages needed for {@code photoCount} photos.
     */
    public int pagesFor(int photoCount) {
        if (photoCount < 0) {
            throw new IllegalArgumentException("Photo count cannot be negative: " + photoCount);
        }
        return (photoCount + photosPerPage - 1) / photosPerPage;
    }

    public int getPhotosPerPage() {
        return photosPerPage;
    }

    public int getColumns() {
        return columns;
    }

    public int getRows() {
        return rows;
    }
}

package com.largomodo.photosheet.core.compose;

import com.largomodo.photosheet.collection.PhotoEntry;

import java.util.List;

/**
 * Strategy interface for distributing photos over output pages.
 * <p>
 * Implementations decide which photos share a page. The compositor relies on the
 * slices covering every photo exactly once, in order.
 */
public interface PagePacker {
    /**
     * Packs photos into page slices.
     *
     * @param photos        photos to distribute, must not be null
     * @param photosPerPage cells per page, at least 1
     * @return page slices, empty if photos is empty
     * @throws IllegalArgumentException if photos is null or photosPerPage is not positive
     */
    List<PageSlice> pack(List<PhotoEntry> photos, int photosPerPage);
}

package com.largomodo.photosheet.core.compose;

import com.largomodo.photosheet.collection.PhotoEntry;

import java.util.List;

/**
 * Immutable assignment of consecutive photos to one output page.
 * <p>
 * Produced by a {@link PagePacker} and consumed by the {@link PageCompositor}. Photo {@code i}
 * of the slice goes to row {@code i / columns}, column {@code i % columns}.
 *
 * @param pageIndex         zero-based page number
 * @param firstPhotoIndex   index of the slice's first photo in the whole export
 * @param photos            photos on this page, in cell order (unmodifiable)
 */
public record PageSlice(int pageIndex, int firstPhotoIndex, List<PhotoEntry> photos) {

    /**
     * Compact constructor that ensures photos is an unmodifiable copy.
     */
    public PageSlice {
        photos = List.copyOf(photos);
    }
}

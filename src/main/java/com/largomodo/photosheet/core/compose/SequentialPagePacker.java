package com.largomodo.photosheet.core.compose;

import com.largomodo.photosheet.collection.PhotoEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills pages in collection order, {@code photosPerPage} photos at a time.
 * <p>
 * Only the last page may be partial; its remaining cells stay empty. Photos are never
 * reordered or compacted, so page {@code p} always starts with photo {@code p * photosPerPage}.
 */
public class SequentialPagePacker implements PagePacker {

    @Override
    public List<PageSlice> pack(List<PhotoEntry> photos, int photosPerPage) {
        if (photos == null) {
            throw new IllegalArgumentException("Photo list cannot be null");
        }
        if (photosPerPage < 1) {
            throw new IllegalArgumentException("Photos per page must be positive, got: " + photosPerPage);
        }

        List<PageSlice> slices = new ArrayList<>();
        int photoIdx = 0;
        while (photoIdx < photos.size()) {
            int end = Math.min(photoIdx + photosPerPage, photos.size());
            slices.add(new PageSlice(slices.size(), photoIdx, photos.subList(photoIdx, end)));
            photoIdx = end;
        }
        return slices;
    }
}

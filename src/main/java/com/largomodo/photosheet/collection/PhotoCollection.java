package com.largomodo.photosheet.collection;

import com.largomodo.photosheet.util.PhotoMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ordered, de-duplicated working set of photos a host edits before exporting.
 * <p>
 * Order is the export order: page and cell assignment follow list position, never the
 * filesystem. Two entries never share a source path; adding a path that is already
 * present is a no-op. Not thread-safe: hosts mutate it from one thread and hand
 * {@link #snapshot()} to the exporter.
 */
public class PhotoCollection {

    private static final Logger log = LoggerFactory.getLogger(PhotoCollection.class);

    private final List<PhotoEntry> entries = new ArrayList<>();

    /**
     * Appends a photo unless it is already present or is not a supported photo file.
     *
     * @param photo path to a photo file
     * @return true if the photo was appended
     */
    public boolean add(Path photo) {
        if (photo == null) {
            return false;
        }
        if (!PhotoMatcher.isPhoto(photo)) {
            log.debug("Skipping unsupported file: {}", photo);
            return false;
        }
        PhotoEntry entry = PhotoEntry.of(photo);
        if (contains(entry.sourcePath())) {
            log.debug("Skipping duplicate photo: {}", entry.sourcePath());
            return false;
        }
        entries.add(entry);
        return true;
    }

    /**
     * Appends photos in iteration order, skipping duplicates and unsupported files.
     *
     * @return number of photos actually appended
     */
    public int addAll(Collection<Path> photos) {
        int added = 0;
        for (Path photo : photos) {
            if (add(photo)) {
                added++;
            }
        }
        return added;
    }

    /**
     * Appends the supported photos directly inside a folder, sorted by file name.
     * <p>
     * Not recursive. Hidden files are ignored.
     *
     * @param folder directory to scan
     * @return number of photos appended
     * @throws IOException if the folder does not exist or cannot be listed
     */
    public int addFolder(Path folder) throws IOException {
        if (!Files.isDirectory(folder)) {
            throw new IOException("Not a directory: " + folder);
        }

        List<Path> photos;
        try (Stream<Path> stream = Files.list(folder)) {
            photos = stream.filter(PhotoMatcher::isPhoto)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }

        int added = addAll(photos);
        log.debug("Added {} of {} photos from {}", added, photos.size(), folder);
        return added;
    }

    public boolean contains(Path photo) {
        Path normalized = photo.toAbsolutePath().normalize();
        return entries.stream().anyMatch(e -> e.sourcePath().equals(normalized));
    }

    public PhotoEntry get(int index) {
        return entries.get(index);
    }

    public PhotoEntry remove(int index) {
        return entries.remove(index);
    }

    /**
     * Moves the entry at {@code from} so that it ends up at position {@code to}.
     *
     * @throws IndexOutOfBoundsException if either index is outside the collection
     */
    public void move(int from, int to) {
        if (to < 0 || to >= entries.size()) {
            throw new IndexOutOfBoundsException("Target index " + to + " out of range for size " + entries.size());
        }
        PhotoEntry entry = entries.remove(from);
        entries.add(to, entry);
    }

    /**
     * Turns the entry at {@code index} one quarter turn clockwise.
     *
     * @return the replacement entry
     */
    public PhotoEntry rotate(int index) {
        PhotoEntry rotated = entries.get(index).rotated();
        entries.set(index, rotated);
        return rotated;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Immutable copy of the current order and rotations.
     * Later edits to this collection do not affect the returned list.
     */
    public List<PhotoEntry> snapshot() {
        return List.copyOf(entries);
    }
}

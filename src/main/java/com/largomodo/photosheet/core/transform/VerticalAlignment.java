package com.largomodo.photosheet.core.transform;

/**
 * Vertical position of a letterboxed photo inside its cell.
 * Top alignment keeps rows of mixed portrait and landscape photos on a common baseline.
 */
public enum VerticalAlignment {
    TOP,
    CENTER;

    int offset(int available, int used) {
        return this == TOP ? 0 : (available - used) / 2;
    }
}

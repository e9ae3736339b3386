package com.largomodo.photosheet.core.transform;

import java.util.Locale;

/**
 * How a photo is fitted into its cell.
 */
public enum FitPolicy {
    /** Scale to cover the cell, center-crop the overflow. Output always equals the cell. */
    FILL_CROP,
    /** Scale to fit inside the cell, keep all content, leave white bars. */
    FIT_LETTERBOX,
    /** Scale to the cell width; the row height follows the tallest photo in the row. */
    FIT_WIDTH_DYNAMIC;

    public static FitPolicy fromCliArgument(String arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Fit policy cannot be null. Supported: FILL_CROP, FIT_LETTERBOX, FIT_WIDTH_DYNAMIC");
        }
        try {
            return valueOf(arg.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid fit policy: " + arg
                    + ". Supported: FILL_CROP, FIT_LETTERBOX, FIT_WIDTH_DYNAMIC");
        }
    }
}

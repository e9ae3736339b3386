package com.largomodo.photosheet.core;

/**
 * Named size factors offered to users.
 * <p>
 * FULL stops at 90% of the nominal cell so the composite never reaches the page edge.
 */
public enum SizeOption {
    HALF(0.50),
    THREE_QUARTER(0.75),
    FULL(0.90);

    private final double factor;

    SizeOption(double factor) {
        this.factor = factor;
    }

    public double getFactor() {
        return factor;
    }
}

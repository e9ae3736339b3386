package com.largomodo.photosheet.core.layout;

/**
 * Physical paper sizes in millimetres, portrait orientation.
 * <p>
 * Exports use one paper size for the whole document; only A4 is offered.
 */
public enum PaperSize {
    A4(210.0, 297.0);

    private final double widthMm;
    private final double heightMm;

    PaperSize(double widthMm, double heightMm) {
        this.widthMm = widthMm;
        this.heightMm = heightMm;
    }

    public double getWidthMm() {
        return widthMm;
    }

    public double getHeightMm() {
        return heightMm;
    }
}

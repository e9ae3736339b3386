package com.largomodo.photosheet.collection;

/**
 * Clockwise photo rotation in quarter turns.
 * <p>
 * A user rotate action always advances by one quarter turn ({@link #next()}), wrapping
 * from 270 back to 0. Rotations are lossless: 90 and 270 swap the image width and height.
 */
public enum Rotation {
    R0(0),
    R90(90),
    R180(180),
    R270(270);

    private final int degrees;

    Rotation(int degrees) {
        this.degrees = degrees;
    }

    /**
     * Resolves a rotation from its degree value.
     *
     * @param degrees clockwise degrees, any multiple of 90 (negative values and full turns are normalized)
     * @return matching rotation
     * @throws IllegalArgumentException if degrees is not a multiple of 90
     */
    public static Rotation fromDegrees(int degrees) {
        if (degrees % 90 != 0) {
            throw new IllegalArgumentException("Rotation must be a multiple of 90 degrees, got: " + degrees);
        }
        int normalized = Math.floorMod(degrees, 360);
        for (Rotation rotation : values()) {
            if (rotation.degrees == normalized) {
                return rotation;
            }
        }
        throw new IllegalStateException("Unreachable rotation: " + normalized);
    }

    public Rotation next() {
        return values()[(ordinal() + 1) % values().length];
    }

    /**
     * Number of clockwise quarter turns (0-3).
     */
    public int quarterTurns() {
        return ordinal();
    }

    /**
     * True when the rotation exchanges width and height.
     */
    public boolean swapsAxes() {
        return this == R90 || this == R270;
    }

    public int getDegrees() {
        return degrees;
    }
}

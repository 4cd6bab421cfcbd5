package com.docsort.model;

/** Clockwise quarter-turn applied to a page before recognition. */
public enum Orientation {
    DEG_0(0), DEG_90(90), DEG_180(180), DEG_270(270);

    private final int degrees;

    Orientation(int degrees) {
        this.degrees = degrees;
    }

    public int degrees() {
        return degrees;
    }

    /**
     * @throws IllegalArgumentException for anything other than 0, 90, 180 or 270
     */
    public static Orientation ofDegrees(int degrees) {
        for (Orientation o : values()) {
            if (o.degrees == degrees) return o;
        }
        throw new IllegalArgumentException("Invalid angle: %d. Must be 0, 90, 180, or 270.".formatted(degrees));
    }
}

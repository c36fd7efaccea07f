package com.questrail.svga.synth;

/**
 * The three overlapping copies that make up one shine sweep. Offsets are
 * fractions of the target width; declaration order is draw order.
 */
public enum ShineBand {
    LEADING(-0.05, 0.3f),
    CENTER(0.0, 0.9f),
    TRAILING(0.05, 0.3f);

    private final double offsetFraction;
    private final float alpha;

    ShineBand(double offsetFraction, float alpha) {
        this.offsetFraction = offsetFraction;
        this.alpha = alpha;
    }

    public double offset(double width) {
        return width * offsetFraction;
    }

    public float alpha() {
        return alpha;
    }
}

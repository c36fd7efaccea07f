package com.questrail.svga.synth;

/**
 * Placement of a new layer in movie (viewBox) coordinates.
 */
public record TargetRect(
    float x,
    float y,
    float width,
    float height
) {
    /**
     * True when either dimension is not positive; such layers render as
     * invisible frames.
     */
    public boolean isDegenerate() {
        return !(width > 0) || !(height > 0);
    }
}

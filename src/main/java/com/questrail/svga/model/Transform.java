package com.questrail.svga.model;

/**
 * 2D affine matrix {@code [a c tx; b d ty]} applied to a frame or a shape.
 *
 * <p>A frame without a transform on the wire decodes as {@link #IDENTITY}.</p>
 */
public record Transform(
        float a,
        float b,
        float c,
        float d,
        float tx,
        float ty
) {
    public static final Transform IDENTITY = new Transform(1f, 0f, 0f, 1f, 0f, 0f);

    /**
     * Uniform scale followed by a translation.
     */
    public static Transform scaleAndTranslate(float scale, float tx, float ty) {
        return new Transform(scale, 0f, 0f, scale, tx, ty);
    }

    public static Transform translate(float tx, float ty) {
        return scaleAndTranslate(1f, tx, ty);
    }
}

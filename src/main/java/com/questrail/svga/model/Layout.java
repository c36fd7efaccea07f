package com.questrail.svga.model;

/**
 * Local bounding rectangle of a frame.
 *
 * <p>An SVGA frame that carries no layout on the wire decodes as {@link #ZERO}.</p>
 */
public record Layout(
        float x,
        float y,
        float width,
        float height
) {
    public static final Layout ZERO = new Layout(0f, 0f, 0f, 0f);

    /**
     * Layout anchored at the origin with the given size.
     */
    public static Layout ofSize(float width, float height) {
        return new Layout(0f, 0f, width, height);
    }
}

package com.questrail.svga.model;

/**
 * Canvas size and timing of an SVGA movie.
 */
public record MovieParams(
        float viewBoxWidth,
        float viewBoxHeight,
        int fps,
        int frames
) {
    public static final MovieParams EMPTY = new MovieParams(0f, 0f, 0, 0);

    public MovieParams withViewBox(float width, float height) {
        return new MovieParams(width, height, fps, frames);
    }
}

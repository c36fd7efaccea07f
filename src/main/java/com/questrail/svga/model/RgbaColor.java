package com.questrail.svga.model;

/**
 * Normalized RGBA colour; each channel is expected in {@code [0, 1]}.
 */
public record RgbaColor(
        float r,
        float g,
        float b,
        float a
) {
}

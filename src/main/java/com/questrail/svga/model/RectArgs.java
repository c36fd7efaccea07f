package com.questrail.svga.model;

public record RectArgs(
        float x,
        float y,
        float width,
        float height,
        float cornerRadius
) implements ShapeArgs {
}

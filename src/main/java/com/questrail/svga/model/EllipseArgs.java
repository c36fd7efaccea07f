package com.questrail.svga.model;

public record EllipseArgs(
        float x,
        float y,
        float radiusX,
        float radiusY
) implements ShapeArgs {
}

package com.questrail.svga.model;

import java.util.Objects;

/**
 * SVG path data ({@code d} attribute syntax).
 */
public record PathArgs(String d) implements ShapeArgs {
    public PathArgs {
        d = Objects.requireNonNullElse(d, "");
    }

    public boolean isEmpty() {
        return d.isEmpty();
    }
}

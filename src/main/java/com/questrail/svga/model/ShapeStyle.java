package com.questrail.svga.model;

import java.util.List;

/**
 * Fill and stroke attributes of a vector shape.
 *
 * <p>{@code fill} and {@code stroke} are {@code null} when the wire message
 * carries no colour for them. The dash pattern is never null.</p>
 */
public record ShapeStyle(
        RgbaColor fill,
        RgbaColor stroke,
        float strokeWidth,
        LineCap lineCap,
        LineJoin lineJoin,
        float miterLimit,
        List<Float> lineDash
) {
    public ShapeStyle {
        lineCap = (lineCap == null) ? LineCap.BUTT : lineCap;
        lineJoin = (lineJoin == null) ? LineJoin.MITER : lineJoin;
        lineDash = (lineDash == null) ? List.of() : List.copyOf(lineDash);
    }
}

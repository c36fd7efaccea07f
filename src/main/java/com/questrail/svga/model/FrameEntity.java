package com.questrail.svga.model;

import java.util.List;
import java.util.Objects;

/**
 * Per-frame state of a sprite.
 *
 * @param alpha     opacity in {@code [0, 1]}
 * @param layout    local bounding box, never null
 * @param transform affine placement, never null
 * @param clipPath  SVG path restricting visible pixels, empty for none
 * @param shapes    vector draw commands, possibly empty
 */
public record FrameEntity(
        float alpha,
        Layout layout,
        Transform transform,
        String clipPath,
        List<ShapeEntity> shapes
) {
    public FrameEntity {
        layout = Objects.requireNonNullElse(layout, Layout.ZERO);
        transform = Objects.requireNonNullElse(transform, Transform.IDENTITY);
        clipPath = Objects.requireNonNullElse(clipPath, "");
        shapes = (shapes == null) ? List.of() : List.copyOf(shapes);
    }

    /**
     * Frame without clip path or shapes.
     */
    public static FrameEntity of(float alpha, Layout layout, Transform transform) {
        return new FrameEntity(alpha, layout, transform, "", List.of());
    }

    public boolean hasClipPath() {
        return !clipPath.isEmpty();
    }
}

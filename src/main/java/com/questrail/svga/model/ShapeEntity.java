package com.questrail.svga.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One vector draw command of a frame.
 *
 * <p>Shapes are carried through the codec untouched apart from field
 * normalization; this project never synthesizes them.</p>
 *
 * @param type      declared shape kind
 * @param args      oneof payload, {@code null} when absent
 * @param style     fill/stroke attributes, {@code null} when absent
 * @param transform shape-local transform, {@code null} when absent
 */
public record ShapeEntity(
        ShapeType type,
        ShapeArgs args,
        ShapeStyle style,
        Transform transform
) {
    public ShapeEntity {
        type = Objects.requireNonNullElse(type, ShapeType.SHAPE);
    }

    public Optional<ShapeArgs> argsIfPresent() {
        return Optional.ofNullable(args);
    }

    public Optional<ShapeStyle> styleIfPresent() {
        return Optional.ofNullable(style);
    }

    public Optional<Transform> transformIfPresent() {
        return Optional.ofNullable(transform);
    }
}

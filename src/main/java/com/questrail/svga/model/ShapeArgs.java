package com.questrail.svga.model;

/**
 * Payload of a {@link ShapeEntity}, mirroring the {@code args} oneof of the
 * wire format. Exactly one variant is present on a shape, or none.
 */
public sealed interface ShapeArgs
        permits PathArgs, RectArgs, EllipseArgs {
}

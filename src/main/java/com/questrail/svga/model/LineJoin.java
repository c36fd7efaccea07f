package com.questrail.svga.model;

/**
 * Stroke line join, numbered as {@code ShapeStyle.LineJoin} on the wire.
 */
public enum LineJoin {
    MITER(0),
    ROUND(1),
    BEVEL(2);

    private final int wireValue;

    LineJoin(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }

    public static LineJoin fromWire(int value) {
        for (LineJoin join : values()) {
            if (join.wireValue == value) {
                return join;
            }
        }
        return MITER;
    }
}

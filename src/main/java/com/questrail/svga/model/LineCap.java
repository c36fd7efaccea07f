package com.questrail.svga.model;

/**
 * Stroke line cap, numbered as {@code ShapeStyle.LineCap} on the wire.
 */
public enum LineCap {
    BUTT(0),
    ROUND(1),
    SQUARE(2);

    private final int wireValue;

    LineCap(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }

    /**
     * Unknown wire values fall back to {@link #BUTT}, the proto3 default.
     */
    public static LineCap fromWire(int value) {
        for (LineCap cap : values()) {
            if (cap.wireValue == value) {
                return cap;
            }
        }
        return BUTT;
    }
}

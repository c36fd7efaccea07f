package com.questrail.svga.model;

/**
 * Vector shape kind, numbered as {@code ShapeEntity.ShapeType} on the wire.
 *
 * <p>{@link #KEEP} tells the player to reuse the shapes of the previous frame.</p>
 */
public enum ShapeType {
    SHAPE(0),
    RECT(1),
    ELLIPSE(2),
    KEEP(3);

    private final int wireValue;

    ShapeType(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }

    public static ShapeType fromWire(int value) {
        for (ShapeType type : values()) {
            if (type.wireValue == value) {
                return type;
            }
        }
        return SHAPE;
    }
}

package com.questrail.svga.raster;

import java.awt.Color;
import java.util.Objects;

/**
 * How a text layer is drawn: bold face, solid colour or a vertical gradient
 * from {@code color} at the top to {@code gradientEnd} at the bottom.
 *
 * @param gradientEnd bottom colour, or {@code null} for a solid fill
 */
public record TextStyle(
        String text,
        float fontSize,
        String fontFamily,
        Color color,
        Color gradientEnd
) {
    public static final String DEFAULT_FONT_FAMILY = "SansSerif";

    public TextStyle {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(color, "color");
        if (!Float.isFinite(fontSize) || fontSize <= 0f) {
            throw new IllegalArgumentException("fontSize must be positive: " + fontSize);
        }
        if (fontFamily == null || fontFamily.isBlank()) {
            fontFamily = DEFAULT_FONT_FAMILY;
        }
    }

    public static TextStyle solid(String text, float fontSize, String fontFamily, Color color) {
        return new TextStyle(text, fontSize, fontFamily, color, null);
    }

    public static TextStyle gradient(String text, float fontSize, String fontFamily, Color top, Color bottom) {
        return new TextStyle(text, fontSize, fontFamily, top, Objects.requireNonNull(bottom, "bottom"));
    }

    public boolean isGradient() {
        return gradientEnd != null;
    }

    /**
     * Parses {@code #RRGGBB} (or {@code RRGGBB}) into an opaque colour.
     */
    public static Color hex(String value) {
        Objects.requireNonNull(value, "value");
        final String digits = value.startsWith("#") ? value.substring(1) : value;
        if (digits.length() != 6) {
            throw new IllegalArgumentException("Expected #RRGGBB: " + value);
        }
        try {
            return new Color(Integer.parseInt(digits, 16));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected #RRGGBB: " + value, e);
        }
    }
}

package com.questrail.svga.model;

import java.util.Base64;
import java.util.Objects;

/**
 * Asset held as base64 text.
 *
 * <p>The text is not validated here. Undecodable or empty text is replaced by
 * the fallback asset when the document is encoded.</p>
 */
public record Base64Image(String base64) implements ImageAsset {
    public Base64Image {
        Objects.requireNonNull(base64, "base64");
    }

    public static Base64Image encode(byte[] bytes) {
        return new Base64Image(Base64.getEncoder().encodeToString(bytes));
    }

    @Override
    public String toString() {
        return "Base64Image[length=" + base64.length() + ']';
    }
}

package com.questrail.svga.model;

import java.util.Arrays;

/**
 * Asset held as raw bytes (normally PNG).
 *
 * The byte array is copied on construction and on access.
 */
public final class RawImage implements ImageAsset
{
    private final byte[] bytes;

    public RawImage(byte[] bytes) {
        this.bytes = (bytes == null) ? new byte[0] : bytes.clone();
    }

    /**
     * Returns a copy of the asset bytes.
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this
                || (obj instanceof RawImage other && Arrays.equals(bytes, other.bytes));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RawImage[length=" + bytes.length + ']';
    }
}

package com.questrail.svga.internal.keys;

import java.util.Arrays;

/**
 * The constant 1x1 fully transparent RGBA PNG substituted wherever image data
 * is missing, empty or undecodable.
 */
public final class FallbackAsset
{
    private static final byte[] PNG = toBytes(
            137, 80, 78, 71, 13, 10, 26, 10, 0, 0, 0, 13, 73, 72, 68, 82, 0, 0, 0, 1, 0,
            0, 0, 1, 8, 6, 0, 0, 0, 31, 21, 196, 137, 0, 0, 0, 1, 115, 82, 71, 66, 0, 174,
            206, 28, 233, 0, 0, 0, 4, 103, 65, 77, 65, 0, 0, 177, 143, 11, 252, 97, 5, 0,
            0, 0, 9, 112, 72, 89, 115, 0, 0, 14, 195, 0, 0, 14, 195, 1, 199, 111, 168,
            100, 0, 0, 0, 13, 73, 68, 65, 84, 24, 87, 99, 248, 255, 255, 255, 127, 0, 9,
            251, 2, 213, 14, 19, 240, 60, 0, 0, 0, 0, 73, 69, 78, 68, 174, 66, 96, 130);

    private FallbackAsset() {}

    /**
     * Returns a copy of the fallback PNG bytes.
     */
    public static byte[] png() {
        return PNG.clone();
    }

    public static boolean isFallback(byte[] bytes) {
        return Arrays.equals(PNG, bytes);
    }

    private static byte[] toBytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }
}

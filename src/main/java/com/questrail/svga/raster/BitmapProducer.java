package com.questrail.svga.raster;

import java.util.concurrent.CompletableFuture;

/**
 * BitmapProducer
 * -----------------------------------------------------------------------------
 * Asynchronous source of PNG rasters for synthesized layers.
 *
 * <p>Every operation completes with encoded PNG bytes. Implementations never
 * complete exceptionally for bad input images; they fall back to the constant
 * transparent 1x1 PNG instead.</p>
 */
public interface BitmapProducer
{
    /**
     * A fully transparent image of the given size.
     */
    CompletableFuture<byte[]> transparent(int width, int height);

    /**
     * Text drawn centred in a box of the given size, shrunk to fit but never enlarged.
     */
    CompletableFuture<byte[]> renderText(TextStyle style, int width, int height);

    /**
     * An encoded image scaled to fit inside the given size, aspect preserved and centred.
     */
    CompletableFuture<byte[]> fitImage(byte[] image, int width, int height);

    /**
     * The highlight raster for a shine sweep.
     *
     * @param source layer content to silhouette, or {@code null} for a plain block
     */
    CompletableFuture<byte[]> shine(byte[] source, int width, int height);

    /**
     * Re-encodes an image as 32-bit ARGB PNG at its own size. Input that
     * cannot be read is returned unchanged.
     */
    CompletableFuture<byte[]> normalize(byte[] image);

    /**
     * Pixel extent for a float dimension: rounded up, at least 1.
     */
    static int pixels(float dimension) {
        if (!Float.isFinite(dimension) || dimension <= 0f) {
            return 1;
        }
        return (int) Math.min(Integer.MAX_VALUE, Math.ceil(dimension));
    }
}

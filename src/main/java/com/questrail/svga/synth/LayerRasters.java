package com.questrail.svga.synth;

import java.util.Optional;

/**
 * Raster bytes acquired for one layer before its frames are computed.
 *
 * Both arrays are copied on the way in and on the way out.
 */
public final class LayerRasters
{
    private final byte[] main;
    private final byte[] shine;

    /**
     * @param main  main sprite raster (never null)
     * @param shine shine raster, {@code null} when the layer has no shine
     */
    public LayerRasters(byte[] main, byte[] shine) {
        if (main == null) {
            throw new NullPointerException("main");
        }
        this.main = main.clone();
        this.shine = (shine == null) ? null : shine.clone();
    }

    public byte[] main() {
        return main.clone();
    }

    public Optional<byte[]> shine() {
        return Optional.ofNullable(shine).map(byte[]::clone);
    }
}

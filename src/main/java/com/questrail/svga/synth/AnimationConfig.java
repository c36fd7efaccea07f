package com.questrail.svga.synth;

/**
 * Tuning shared by all presets of one layer.
 *
 * @param cycles    full motion periods over the length of the movie
 * @param intensity amplitude multiplier (pulse scale, float distance, shine band width)
 */
public record AnimationConfig(
    float cycles,
    float intensity
) {
    public static final AnimationConfig DEFAULT = new AnimationConfig(1f, 1f);

    public AnimationConfig {
        if (!(cycles > 0) || Float.isInfinite(cycles)) {
            throw new IllegalArgumentException("cycles must be a positive number: " + cycles);
        }
        if (!(intensity > 0) || Float.isInfinite(intensity)) {
            throw new IllegalArgumentException("intensity must be a positive number: " + intensity);
        }
    }
}

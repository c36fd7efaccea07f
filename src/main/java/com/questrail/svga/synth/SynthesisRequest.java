package com.questrail.svga.synth;

import com.questrail.svga.internal.keys.KeyRegistry;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One layer to be added to a document.
 */
public final class SynthesisRequest
{
    private final TargetRect rect;
    private final String keyName;
    private final byte[] raster;
    private final Set<AnimationPreset> presets;
    private final AnimationConfig config;

    private SynthesisRequest(Builder builder) {
        this.rect = Objects.requireNonNull(builder.rect, "rect");
        this.keyName = Objects.requireNonNull(builder.keyName, "keyName");
        if (KeyRegistry.sanitize(keyName).isEmpty()) {
            throw new IllegalArgumentException("keyName must not be empty");
        }
        this.raster = (builder.raster == null) ? null : builder.raster.clone();
        this.presets = Collections.unmodifiableSet(builder.presets.isEmpty()
                ? EnumSet.noneOf(AnimationPreset.class)
                : EnumSet.copyOf(builder.presets));
        this.config = Objects.requireNonNull(builder.config, "config");
    }

    public TargetRect rect() {
        return rect;
    }

    /**
     * The key name as supplied; sanitized when the layer is synthesized.
     */
    public String keyName() {
        return keyName;
    }

    /**
     * Caller-supplied raster for the main sprite, if any.
     */
    public Optional<byte[]> raster() {
        return Optional.ofNullable(raster).map(byte[]::clone);
    }

    public Set<AnimationPreset> presets() {
        return presets;
    }

    public boolean has(AnimationPreset preset) {
        return presets.contains(preset);
    }

    public AnimationConfig config() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TargetRect rect;
        private String keyName;
        private byte[] raster;
        private Set<AnimationPreset> presets = EnumSet.noneOf(AnimationPreset.class);
        private AnimationConfig config = AnimationConfig.DEFAULT;

        public Builder withRect(TargetRect rect) {
            this.rect = rect;
            return this;
        }

        public Builder withRect(float x, float y, float width, float height) {
            return withRect(new TargetRect(x, y, width, height));
        }

        public Builder withKeyName(String keyName) {
            this.keyName = keyName;
            return this;
        }

        public Builder withRaster(byte[] raster) {
            this.raster = raster;
            return this;
        }

        public Builder withPresets(Set<AnimationPreset> presets) {
            this.presets = Objects.requireNonNull(presets, "presets");
            return this;
        }

        public Builder withPresets(AnimationPreset first, AnimationPreset... rest) {
            return withPresets(EnumSet.of(first, rest));
        }

        public Builder withConfig(AnimationConfig config) {
            this.config = config;
            return this;
        }

        public SynthesisRequest build() {
            return new SynthesisRequest(this);
        }
    }
}

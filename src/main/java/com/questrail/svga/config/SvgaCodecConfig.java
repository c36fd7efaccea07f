package com.questrail.svga.config;

import java.util.Objects;
import java.util.zip.Deflater;

/**
 * Codec settings applied on the encode path.
 *
 * @param compressionLevel  zlib level used when compression is requested
 * @param outputVersion     value written to {@code MovieEntity.version}
 * @param fallbackViewBox   viewBox width/height substituted for non-numeric values
 * @param fallbackFps       frame rate substituted when the document has none
 */
public record SvgaCodecConfig(
    int compressionLevel,
    String outputVersion,
    float fallbackViewBox,
    int fallbackFps
) {
    public static final int DEFAULT_COMPRESSION_LEVEL = 6;
    public static final String SUPPORTED_VERSION = "2.0";

    public SvgaCodecConfig {
        if (compressionLevel < Deflater.NO_COMPRESSION || compressionLevel > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("compressionLevel must be 0-9: " + compressionLevel);
        }
        Objects.requireNonNull(outputVersion, "outputVersion");
        if (!(fallbackViewBox > 0)) {
            throw new IllegalArgumentException("fallbackViewBox must be positive");
        }
        if (fallbackFps <= 0) {
            throw new IllegalArgumentException("fallbackFps must be positive");
        }
    }

    public static SvgaCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int compressionLevel = DEFAULT_COMPRESSION_LEVEL;
        private String outputVersion = SUPPORTED_VERSION;
        private float fallbackViewBox = 800f;
        private int fallbackFps = 20;

        public Builder withCompressionLevel(int compressionLevel) {
            this.compressionLevel = compressionLevel;
            return this;
        }

        public Builder withOutputVersion(String outputVersion) {
            this.outputVersion = outputVersion;
            return this;
        }

        public Builder withFallbackViewBox(float fallbackViewBox) {
            this.fallbackViewBox = fallbackViewBox;
            return this;
        }

        public Builder withFallbackFps(int fallbackFps) {
            this.fallbackFps = fallbackFps;
            return this;
        }

        public SvgaCodecConfig build() {
            return new SvgaCodecConfig(compressionLevel, outputVersion, fallbackViewBox, fallbackFps);
        }
    }
}

package com.questrail.svga.observability;

import com.questrail.svga.codec.CompressionStage;

import java.time.Instant;

/**
 * Record representing one successful container decode.
 */
public record SvgaDecodeEvent(
    Instant timestamp,
    CompressionStage stage,
    int containerBytes,
    int payloadBytes,
    int imageCount,
    int spriteCount
) {
}

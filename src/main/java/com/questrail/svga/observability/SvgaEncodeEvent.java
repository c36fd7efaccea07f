package com.questrail.svga.observability;

import java.time.Instant;

/**
 * Record representing one successful document encode.
 */
public record SvgaEncodeEvent(
    Instant timestamp,
    boolean compressed,
    int payloadBytes,
    int outputBytes,
    int imageCount,
    int spriteCount
) {
}

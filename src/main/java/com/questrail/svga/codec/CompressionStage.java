package com.questrail.svga.codec;

/**
 * Which decompression attempt produced the payload that was parsed.
 */
public enum CompressionStage {
    /** Standard zlib-wrapped DEFLATE (RFC 1950). */
    ZLIB,
    /** Headerless DEFLATE (RFC 1951). */
    RAW_DEFLATE,
    /** Neither inflate variant accepted the input; parsed as-is. */
    NONE;

    public boolean decompressed() {
        return this != NONE;
    }
}

package com.questrail.svga.observability;

/**
 * Non-fatal conditions the encoder repairs locally.
 */
public enum RepairKind {
    /** A sprite referenced an asset key absent from {@code images}; fallback asset inserted. */
    INVALID_REFERENCE,
    /** An asset was empty or not valid base64; fallback asset substituted. */
    INVALID_RASTER_DATA,
    /** Two asset keys sanitized to the same name; the later one was suffixed. */
    KEY_COLLISION,
    /** A path shape without path data was rewritten as {@code KEEP}. */
    SHAPE_RECLASSIFIED
}

package com.questrail.svga.compose;

/**
 * What supplies the pixels of an editor layer.
 */
public enum LayerKind
{
    /** Transparent placeholder swapped in by the player at runtime. */
    KEY,
    /** Rendered text. */
    TEXT,
    /** An uploaded picture fitted into the layer box. */
    IMAGE
}

package com.questrail.svga.codec;

/**
 * The container starts with the ZIP signature ({@code PK}) used by SVGA 1.x.
 * Raised before any decompression is attempted.
 */
public final class UnsupportedLegacyFormatException extends SvgaCodecException
{
    public UnsupportedLegacyFormatException() {
        super("ZIP-based SVGA (v1.x) files are not supported. Please use SVGA 2.0 files.");
    }
}

package com.questrail.svga.codec;

/**
 * Encoding aborted. No output buffer was returned.
 */
public final class SvgaEncodeException extends SvgaCodecException
{
    public SvgaEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

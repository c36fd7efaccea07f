package com.questrail.svga.codec;

/**
 * The protocol-buffer schema (or the runtime behind it) could not be made
 * ready. Not retried.
 */
public final class DependencyUnavailableException extends SvgaCodecException
{
    public DependencyUnavailableException(String message) {
        super(message);
    }

    public DependencyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.svga.codec;

/**
 * Base type of every fatal codec failure.
 *
 * <p>Codec operations are atomic: when one of these is thrown, no partial
 * document or partial byte buffer has been produced.</p>
 */
public class SvgaCodecException extends RuntimeException
{
    public SvgaCodecException(String message) {
        super(message);
    }

    public SvgaCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}

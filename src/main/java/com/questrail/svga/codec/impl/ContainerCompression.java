package com.questrail.svga.codec.impl;

import com.questrail.svga.codec.CompressionStage;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * ContainerCompression
 * -----------------------------------------------------------------------------
 * DEFLATE handling for SVGA 2.0 containers.
 *
 * <p>Inbound, the payload is tried as zlib-wrapped DEFLATE (RFC 1950), then as
 * headerless DEFLATE (RFC 1951), and finally taken as already uncompressed.
 * Outbound, payloads are wrapped in zlib framing at a configurable level.</p>
 *
 * <p>An inflate attempt only counts as successful when the stream reaches its
 * end marker and consumes the whole input.</p>
 */
final class ContainerCompression
{
    private static final int CHUNK = 8192;

    /** Bytes 0-1 of a ZIP local file header ("PK"), used by SVGA 1.x. */
    static final int ZIP_SIGNATURE_0 = 0x50;
    static final int ZIP_SIGNATURE_1 = 0x4B;

    private ContainerCompression() {}

    /**
     * Result of the inflate cascade.
     */
    record Inflated(byte[] payload, CompressionStage stage) {}

    static boolean isLegacyZip(byte[] container) {
        return container.length >= 2
                && (container[0] & 0xFF) == ZIP_SIGNATURE_0
                && (container[1] & 0xFF) == ZIP_SIGNATURE_1;
    }

    static Inflated inflate(byte[] container) {
        try {
            return new Inflated(inflate(container, false), CompressionStage.ZLIB);
        }
        catch (DataFormatException zlibFailure) {
            try {
                return new Inflated(inflate(container, true), CompressionStage.RAW_DEFLATE);
            }
            catch (DataFormatException rawFailure) {
                return new Inflated(container, CompressionStage.NONE);
            }
        }
    }

    static byte[] inflate(byte[] input, boolean raw) throws DataFormatException {
        final Inflater inflater = new Inflater(raw);
        try {
            inflater.setInput(input);
            final ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(CHUNK, input.length * 2));
            final byte[] buffer = new byte[CHUNK];
            while (!inflater.finished()) {
                final int n = inflater.inflate(buffer);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DataFormatException("Truncated DEFLATE stream");
                }
                out.write(buffer, 0, n);
            }
            if (inflater.getRemaining() > 0) {
                throw new DataFormatException("Trailing bytes after DEFLATE stream");
            }
            return out.toByteArray();
        }
        finally {
            inflater.end();
        }
    }

    static byte[] deflate(byte[] payload, int level) {
        final Deflater deflater = new Deflater(level, false);
        try {
            deflater.setInput(payload);
            deflater.finish();
            final ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, payload.length / 2));
            final byte[] buffer = new byte[CHUNK];
            while (!deflater.finished()) {
                final int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        }
        finally {
            deflater.end();
        }
    }
}

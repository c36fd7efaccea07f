package com.questrail.svga.codec;

/**
 * The container payload could not be parsed as an SVGA {@code MovieEntity}.
 *
 * <p>{@link #decompressed()} separates the two typical causes:</p>
 * <ul>
 *   <li>{@code false}: neither zlib nor raw inflate accepted the bytes, so the
 *       compressed stream itself is probably truncated or corrupt</li>
 *   <li>{@code true}: the stream inflated cleanly but the protobuf payload
 *       does not conform to the schema</li>
 * </ul>
 */
public final class MalformedContainerException extends SvgaCodecException
{
    private final boolean decompressed;

    public MalformedContainerException(String detail, boolean decompressed, Throwable cause) {
        super(describe(detail, decompressed), cause);
        this.decompressed = decompressed;
    }

    /**
     * Returns whether decompression succeeded before parsing failed.
     */
    public boolean decompressed() {
        return decompressed;
    }

    private static String describe(String detail, boolean decompressed) {
        StringBuilder msg = new StringBuilder("Failed to decode SVGA protobuf structure.");
        if (decompressed) {
            msg.append(" The payload inflated but does not match the SVGA 2.0 schema.");
        } else {
            msg.append(" The file might be compressed in an unsupported format or corrupted.");
        }
        if (detail != null && !detail.isEmpty()) {
            msg.append(" Details: ").append(detail);
        }
        return msg.toString();
    }
}

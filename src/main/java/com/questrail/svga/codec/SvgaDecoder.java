package com.questrail.svga.codec;

import com.questrail.svga.model.SvgaDocument;

/**
 * SvgaDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for SVGA 2.0 containers.
 *
 * <p>The decoder is responsible for:</p>
 * <ul>
 *   <li>Rejecting the legacy ZIP container</li>
 *   <li>Undoing the optional zlib/DEFLATE compression</li>
 *   <li>Parsing the {@code MovieEntity} protobuf payload</li>
 *   <li>Converting it into an {@link SvgaDocument} with explicit defaults</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for normalizing field
 * values or repairing references; that happens on the encode path.</p>
 */
public interface SvgaDecoder
{
    /**
     * Decode one complete container.
     *
     * @param container raw file bytes
     * @return the decoded document
     * @throws UnsupportedLegacyFormatException if the bytes carry the ZIP signature
     * @throws MalformedContainerException      if the payload cannot be parsed
     * @throws DependencyUnavailableException   if the schema is unavailable
     */
    SvgaDocument decode(byte[] container);
}

package com.questrail.svga.codec;

import com.questrail.svga.model.SvgaDocument;

/**
 * SvgaEncoder
 * -----------------------------------------------------------------------------
 * Serializes an {@link SvgaDocument} into an SVGA 2.0 container.
 *
 * <p>The encoder normalizes every field, repairs dangling asset references
 * with the fallback asset and always serializes a fresh payload. Repairs are
 * reported to the observability sink and never fail the operation.</p>
 */
public interface SvgaEncoder
{
    /**
     * Encode a document.
     *
     * @param document the document to serialize
     * @param compress wrap the payload in zlib-framed DEFLATE when true
     * @return a new wire-ready byte buffer
     * @throws SvgaEncodeException            if serialization fails anywhere
     * @throws DependencyUnavailableException if the schema is unavailable
     */
    byte[] encode(SvgaDocument document, boolean compress);

    /**
     * Encode with compression enabled.
     */
    default byte[] encode(SvgaDocument document) {
        return encode(document, true);
    }
}

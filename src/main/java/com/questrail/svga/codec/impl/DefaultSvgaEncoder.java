package com.questrail.svga.codec.impl;

import com.questrail.svga.codec.SvgaCodecContext;
import com.questrail.svga.codec.SvgaCodecException;
import com.questrail.svga.codec.SvgaEncodeException;
import com.questrail.svga.codec.SvgaEncoder;
import com.questrail.svga.internal.convert.MovieWriter;
import com.questrail.svga.internal.sanitize.DocumentSanitizer;
import com.questrail.svga.model.SvgaDocument;
import com.questrail.svga.observability.SvgaEncodeEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * DefaultSvgaEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SvgaEncoder}.
 *
 * <p>This is the inverse of {@link DefaultSvgaDecoder}, with normalization in
 * front:</p>
 * <ol>
 *   <li>Sanitize: asset keys, reference repair, field policies, version pin</li>
 *   <li>Build a fresh {@code MovieEntity} message</li>
 *   <li>Serialize</li>
 *   <li>Optionally wrap in zlib framing at the configured level</li>
 * </ol>
 *
 * <p>Encoding is atomic. Any failure is raised as {@link SvgaEncodeException}
 * and no buffer is returned.</p>
 */
public final class DefaultSvgaEncoder implements SvgaEncoder
{
    private final SvgaCodecContext context;
    private final DocumentSanitizer sanitizer;
    private final MovieWriter writer;

    public DefaultSvgaEncoder(SvgaCodecContext context) {
        this.context = Objects.requireNonNull(context, "context");
        this.sanitizer = new DocumentSanitizer(context.config(), context.sink());
        this.writer = new MovieWriter(context.schema());
    }

    @Override
    public byte[] encode(SvgaDocument document, boolean compress)
    {
        Objects.requireNonNull(document, "document");

        try {
            final SvgaDocument normalized = sanitizer.sanitize(document);
            final byte[] payload = writer.write(normalized).toByteArray();
            final byte[] output = compress
                    ? ContainerCompression.deflate(payload, context.config().compressionLevel())
                    : payload;

            context.sink().onEncode(new SvgaEncodeEvent(
                    Instant.now(),
                    compress,
                    payload.length,
                    output.length,
                    normalized.images().size(),
                    normalized.sprites().size()));
            return output;
        }
        catch (SvgaCodecException e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new SvgaEncodeException("Failed to encode SVGA document: " + e.getMessage(), e);
        }
    }
}

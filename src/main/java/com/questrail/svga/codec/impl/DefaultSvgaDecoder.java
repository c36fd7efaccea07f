package com.questrail.svga.codec.impl;

import com.google.protobuf.DynamicMessage;
import com.google.protobuf.InvalidProtocolBufferException;
import com.questrail.svga.codec.MalformedContainerException;
import com.questrail.svga.codec.SvgaCodecContext;
import com.questrail.svga.codec.SvgaDecoder;
import com.questrail.svga.codec.UnsupportedLegacyFormatException;
import com.questrail.svga.internal.convert.MovieReader;
import com.questrail.svga.model.SvgaDocument;
import com.questrail.svga.observability.SvgaDecodeEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * DefaultSvgaDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SvgaDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Legacy check: a leading {@code PK} signature is rejected outright</li>
 *   <li>Inflate cascade: zlib, then raw DEFLATE, then the bytes as given</li>
 *   <li>Protobuf parse against {@code MovieEntity}</li>
 *   <li>Conversion into {@link SvgaDocument} with explicit defaults</li>
 * </ol>
 *
 * <p>No retries beyond the two inflate attempts; no partial documents.</p>
 */
public final class DefaultSvgaDecoder implements SvgaDecoder
{
    private final SvgaCodecContext context;
    private final MovieReader reader = new MovieReader();

    public DefaultSvgaDecoder(SvgaCodecContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public SvgaDocument decode(byte[] container)
    {
        Objects.requireNonNull(container, "container");

        // 1) SVGA 1.x is a ZIP archive; never try to inflate it
        if (ContainerCompression.isLegacyZip(container)) {
            throw new UnsupportedLegacyFormatException();
        }

        // 2) Inflate cascade
        final ContainerCompression.Inflated inflated = ContainerCompression.inflate(container);
        final boolean decompressed = inflated.stage().decompressed();

        // 3) Structural parse
        final DynamicMessage movie;
        try {
            movie = DynamicMessage.parseFrom(context.schema().movieEntity(), inflated.payload());
        }
        catch (InvalidProtocolBufferException e) {
            throw new MalformedContainerException(e.getMessage(), decompressed, e);
        }

        // 4) Canonical model
        final SvgaDocument document;
        try {
            document = reader.read(movie);
        }
        catch (RuntimeException e) {
            throw new MalformedContainerException(e.getMessage(), decompressed, e);
        }

        context.sink().onDecode(new SvgaDecodeEvent(
                Instant.now(),
                inflated.stage(),
                container.length,
                inflated.payload().length,
                document.images().size(),
                document.sprites().size()));
        return document;
    }
}

package com.questrail.svga.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SvgaObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSvgaObservabilitySink implements SvgaObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSvgaObservabilitySink.class);

    @Override
    public void onDecode(SvgaDecodeEvent event) {
        if (!event.stage().decompressed()) {
            log.warn("SVGA decompression failed or file is uncompressed; parsed {} bytes as-is",
                event.containerBytes());
        }
        log.debug("SVGA decoded: stage={} payload={}B images={} sprites={}",
            event.stage(), event.payloadBytes(), event.imageCount(), event.spriteCount());
    }

    @Override
    public void onEncode(SvgaEncodeEvent event) {
        log.debug("SVGA encoded: compressed={} payload={}B output={}B images={} sprites={}",
            event.compressed(), event.payloadBytes(), event.outputBytes(),
            event.imageCount(), event.spriteCount());
    }

    @Override
    public void onRepair(SvgaRepairEvent event) {
        log.warn("SVGA repair {} [{}]: {}", event.kind(), event.subject(), event.detail());
    }
}

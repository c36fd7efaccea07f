package com.questrail.svga.observability;

/**
 * No-op implementation of SvgaObservabilitySink.
 */
public final class NullObservabilitySink implements SvgaObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onDecode(SvgaDecodeEvent event) {}

    @Override
    public void onEncode(SvgaEncodeEvent event) {}

    @Override
    public void onRepair(SvgaRepairEvent event) {}
}

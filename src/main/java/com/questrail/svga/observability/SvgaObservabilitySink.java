package com.questrail.svga.observability;

/**
 * Main interface for receiving SVGA codec observability events.
 * Implementations can provide logging, metrics, or test recording.
 */
public interface SvgaObservabilitySink {
    /**
     * Called after a container has been decoded.
     * @param event decode summary, including which decompression stage applied
     */
    void onDecode(SvgaDecodeEvent event);

    /**
     * Called after a document has been encoded.
     * @param event encode summary
     */
    void onEncode(SvgaEncodeEvent event);

    /**
     * Called whenever a non-fatal defect is repaired.
     * @param event the repair details
     */
    void onRepair(SvgaRepairEvent event);
}

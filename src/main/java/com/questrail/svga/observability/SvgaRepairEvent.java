package com.questrail.svga.observability;

import java.time.Instant;

/**
 * Record representing a repair applied while normalizing a document.
 *
 * @param subject the asset key or sprite the repair applies to
 */
public record SvgaRepairEvent(
    Instant timestamp,
    RepairKind kind,
    String subject,
    String detail
) {
    public static SvgaRepairEvent now(RepairKind kind, String subject, String detail) {
        return new SvgaRepairEvent(Instant.now(), kind, subject, detail);
    }
}

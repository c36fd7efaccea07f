package com.questrail.svga.compose;

import java.util.Objects;
import java.util.Optional;

/**
 * Output settings for {@link LayerComposer#export}.
 *
 * @param baseName    file name without extension; sanitized on use
 * @param compress    zlib-wrap the payload
 * @param viewBox     replacement canvas size, or {@code null} to keep the document's
 */
public record ExportOptions(String baseName, boolean compress, ViewBox viewBox)
{
    public record ViewBox(float width, float height) {}

    public ExportOptions {
        Objects.requireNonNull(baseName, "baseName");
    }

    public static ExportOptions defaults() {
        return new ExportOptions(ExportNaming.DEFAULT_BASE_NAME, true, null);
    }

    public ExportOptions withBaseName(String newBaseName) {
        return new ExportOptions(newBaseName, compress, viewBox);
    }

    public ExportOptions withCompression(boolean newCompress) {
        return new ExportOptions(baseName, newCompress, viewBox);
    }

    public ExportOptions withViewBox(float width, float height) {
        return new ExportOptions(baseName, compress, new ViewBox(width, height));
    }

    public Optional<ViewBox> viewBoxOverride() {
        return Optional.ofNullable(viewBox);
    }
}

package com.questrail.svga.compose;

import com.questrail.svga.model.SvgaDocument;

import java.util.Objects;

/**
 * An encoded container together with its file name and the document it was
 * encoded from.
 */
public final class ExportResult
{
    private final String fileName;
    private final byte[] bytes;
    private final SvgaDocument document;

    public ExportResult(String fileName, byte[] bytes, SvgaDocument document) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
        this.document = Objects.requireNonNull(document, "document");
    }

    public String fileName() {
        return fileName;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public SvgaDocument document() {
        return document;
    }

    @Override
    public String toString() {
        return "ExportResult{" + fileName + ", " + bytes.length + " bytes}";
    }
}

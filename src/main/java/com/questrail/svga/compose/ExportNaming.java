package com.questrail.svga.compose;

import com.questrail.svga.internal.keys.KeyRegistry;

import java.util.Locale;
import java.util.Objects;

/**
 * File names for exported containers.
 */
public final class ExportNaming
{
    public static final String DEFAULT_BASE_NAME = "output";
    public static final String EXTENSION = ".svga";
    static final String RAW_SUFFIX = "_raw";
    static final String PATCHED_SUFFIX = "_patched";

    private ExportNaming() {}

    /**
     * {@code <sanitized base>[_raw].svga}; an empty base becomes {@code output}.
     */
    public static String fileName(String baseName, boolean compressed) {
        Objects.requireNonNull(baseName, "baseName");
        String safe = KeyRegistry.sanitize(baseName);
        if (safe.isEmpty()) {
            safe = DEFAULT_BASE_NAME;
        }
        return safe + (compressed ? "" : RAW_SUFFIX) + EXTENSION;
    }

    /**
     * Suggested base name for a patched copy of {@code inputFileName}: the
     * input name without its {@code .svga} extension, plus {@code _patched}.
     */
    public static String patchedBaseName(String inputFileName) {
        Objects.requireNonNull(inputFileName, "inputFileName");
        String base = inputFileName;
        if (base.toLowerCase(Locale.ROOT).endsWith(EXTENSION)) {
            base = base.substring(0, base.length() - EXTENSION.length());
        }
        return base + PATCHED_SUFFIX;
    }
}

package com.questrail.svga.internal.keys;

import com.questrail.svga.model.ImageAsset;
import com.questrail.svga.model.RawImage;
import com.questrail.svga.observability.RepairKind;
import com.questrail.svga.observability.SvgaObservabilitySink;
import com.questrail.svga.observability.SvgaRepairEvent;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * KeyRegistry
 * =============================================================================
 * Asset-key sanitization and reference repair for one encode pass.
 *
 * <h2>Key charset</h2>
 * <p>Mobile players use asset keys as file names, so every character outside
 * {@code [A-Za-z0-9_-]} is replaced with {@code _}.</p>
 *
 * <h2>Mapping</h2>
 * <p>Each original key maps to exactly one sanitized key. When two original
 * keys sanitize to the same name, the later one gets a numeric suffix
 * ({@code _2}, {@code _3}, ...) so distinct assets stay distinct.</p>
 *
 * <h2>Repair</h2>
 * <p>{@link #resolve(String, String)} guarantees that the returned key is
 * present in {@link #assets()}: a reference with no asset behind it receives
 * the {@link FallbackAsset}. Nothing in this class throws on bad input.</p>
 */
public final class KeyRegistry
{
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_\\-]");

    private final Map<String, String> mapping = new HashMap<>();
    private final Map<String, byte[]> assets = new LinkedHashMap<>();
    private final SvgaObservabilitySink sink;

    private KeyRegistry(SvgaObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Replaces every character outside {@code [A-Za-z0-9_-]} with {@code _}.
     * {@code null} becomes the empty string.
     */
    public static String sanitize(String key) {
        if (key == null || key.isEmpty()) {
            return "";
        }
        return UNSAFE.matcher(key).replaceAll("_");
    }

    /**
     * Registers every asset of a document, resolving its bytes.
     *
     * <p>Empty or undecodable assets are replaced by the fallback PNG and
     * reported as {@link RepairKind#INVALID_RASTER_DATA}.</p>
     */
    public static KeyRegistry register(Map<String, ImageAsset> images, SvgaObservabilitySink sink) {
        KeyRegistry registry = new KeyRegistry(sink);
        images.forEach(registry::add);
        return registry;
    }

    private void add(String key, ImageAsset asset) {
        final String safeKey = uniqueKey(key, sanitize(key));
        mapping.put(key, safeKey);

        final byte[] bytes = ImageAssets.bytes(asset).orElse(null);
        if (bytes == null) {
            sink.onRepair(SvgaRepairEvent.now(RepairKind.INVALID_RASTER_DATA, safeKey,
                    "Asset is empty or undecodable; substituted fallback image"));
            assets.put(safeKey, FallbackAsset.png());
        } else {
            assets.put(safeKey, bytes);
        }
    }

    private String uniqueKey(String original, String safeKey) {
        if (!assets.containsKey(safeKey)) {
            return safeKey;
        }
        int n = 2;
        while (assets.containsKey(safeKey + '_' + n)) {
            n++;
        }
        final String renamed = safeKey + '_' + n;
        sink.onRepair(SvgaRepairEvent.now(RepairKind.KEY_COLLISION, original,
                "Sanitized key '" + safeKey + "' already taken; renamed to '" + renamed + "'"));
        return renamed;
    }

    /**
     * Returns the sanitized form of a reference without repairing it.
     */
    public String remap(String key) {
        if (key == null || key.isEmpty()) {
            return "";
        }
        final String mapped = mapping.get(key);
        return (mapped != null) ? mapped : sanitize(key);
    }

    /**
     * Returns the sanitized form of a reference, inserting the fallback asset
     * when nothing is registered under it. Empty references stay empty.
     *
     * @param owner describes the referencing sprite, for the repair report
     */
    public String resolve(String key, String owner) {
        final String safeKey = remap(key);
        if (!safeKey.isEmpty() && !assets.containsKey(safeKey)) {
            sink.onRepair(SvgaRepairEvent.now(RepairKind.INVALID_REFERENCE, safeKey,
                    "Fixing missing image reference from " + owner));
            assets.put(safeKey, FallbackAsset.png());
        }
        return safeKey;
    }

    /**
     * Returns the sanitized assets in registration order.
     */
    public Map<String, ImageAsset> assets() {
        Map<String, ImageAsset> out = new LinkedHashMap<>();
        assets.forEach((key, bytes) -> out.put(key, new RawImage(bytes)));
        return Collections.unmodifiableMap(out);
    }

    /**
     * Returns the original→sanitized key mapping for registered assets.
     */
    public Map<String, String> mapping() {
        return Collections.unmodifiableMap(mapping);
    }
}

package com.questrail.svga.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SvgaDocument
 * -----------------------------------------------------------------------------
 * Canonical in-memory form of one SVGA movie container.
 *
 * <h2>Ownership</h2>
 * <p>A document is an immutable snapshot. Every {@code with...} method returns
 * a new document with freshly copied containers, so the {@code images} map and
 * the {@code sprites} list are never shared between a document and the one
 * derived from it.</p>
 *
 * <h2>Ordering</h2>
 * <p>{@code images} keeps insertion order so that encoding is deterministic;
 * {@code sprites} order is draw order.</p>
 */
public record SvgaDocument(
        String version,
        MovieParams params,
        Map<String, ImageAsset> images,
        List<SpriteEntity> sprites,
        List<AudioEntity> audios
) {
    public SvgaDocument {
        version = Objects.requireNonNullElse(version, "");
        params = Objects.requireNonNullElse(params, MovieParams.EMPTY);
        images = (images == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(images));
        sprites = (sprites == null) ? List.of() : List.copyOf(sprites);
        audios = (audios == null) ? List.of() : List.copyOf(audios);
    }

    /**
     * Empty movie with the given canvas and timing.
     */
    public static SvgaDocument empty(MovieParams params) {
        return new SvgaDocument("2.0", params, Map.of(), List.of(), List.of());
    }

    public int totalFrames() {
        return Math.max(0, params.frames());
    }

    public SvgaDocument withParams(MovieParams newParams) {
        return new SvgaDocument(version, newParams, images, sprites, audios);
    }

    public SvgaDocument withImages(Map<String, ImageAsset> newImages) {
        return new SvgaDocument(version, params, newImages, sprites, audios);
    }

    public SvgaDocument withSprites(List<SpriteEntity> newSprites) {
        return new SvgaDocument(version, params, images, newSprites, audios);
    }

    /**
     * Returns a document with {@code added} assets put over the existing ones
     * and {@code appended} sprites drawn after the existing ones.
     */
    public SvgaDocument withLayers(Map<String, ImageAsset> added, List<SpriteEntity> appended) {
        Map<String, ImageAsset> mergedImages = new LinkedHashMap<>(images);
        mergedImages.putAll(added);

        List<SpriteEntity> mergedSprites = new ArrayList<>(sprites.size() + appended.size());
        mergedSprites.addAll(sprites);
        mergedSprites.addAll(appended);

        return new SvgaDocument(version, params, mergedImages, mergedSprites, audios);
    }
}

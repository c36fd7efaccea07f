package com.questrail.svga.synth;

import com.questrail.svga.internal.keys.KeyRegistry;
import com.questrail.svga.model.ImageAsset;
import com.questrail.svga.model.RawImage;
import com.questrail.svga.model.SpriteEntity;
import com.questrail.svga.model.SvgaDocument;
import com.questrail.svga.raster.BitmapProducer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * LayerSynthesizer
 * =============================================================================
 * Adds one animated layer to a document.
 *
 * <h2>Effect boundary</h2>
 * <p>Rasterization is the only asynchronous step. {@link #acquireRasters}
 * obtains every raster the layer needs from a {@link BitmapProducer}; the
 * pure {@link #synthesize(SvgaDocument, SynthesisRequest, LayerRasters)}
 * then computes frames and splices them in.</p>
 *
 * <h2>Output</h2>
 * <ul>
 *   <li>Asset {@code key} holds the main raster; {@code key_shine} the shine raster</li>
 *   <li>Sprites are appended in the order main, leading, center, trailing</li>
 *   <li>Every new sprite has exactly {@code params.frames} frames</li>
 *   <li>The input document is left untouched</li>
 * </ul>
 *
 * <p>Layers are composed by calling this once per layer, in creation order.</p>
 */
public final class LayerSynthesizer
{
    static final String SHINE_SUFFIX = "_shine";

    /**
     * Pure synthesis with rasters already in hand.
     *
     * @throws IllegalArgumentException if shine is requested without a shine raster
     */
    public SvgaDocument synthesize(SvgaDocument document, SynthesisRequest request, LayerRasters rasters) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(rasters, "rasters");

        final String key = KeyRegistry.sanitize(request.keyName());
        final int totalFrames = document.totalFrames();

        final Map<String, ImageAsset> images = new LinkedHashMap<>();
        final List<SpriteEntity> sprites = new ArrayList<>(4);

        images.put(key, new RawImage(rasters.main()));
        sprites.add(SpriteEntity.of(key, LayerGeometry.mainTrack(
                request.rect(), request.presets(), request.config(), totalFrames)));

        if (request.has(AnimationPreset.SHINE)) {
            final byte[] shine = rasters.shine().orElseThrow(() ->
                    new IllegalArgumentException("Shine requested for '" + key + "' without a shine raster"));
            final String shineKey = key + SHINE_SUFFIX;
            images.put(shineKey, new RawImage(shine));
            for (ShineBand band : ShineBand.values()) {
                sprites.add(SpriteEntity.of(shineKey, LayerGeometry.shineTrack(
                        request.rect(), band, request.config(), totalFrames)));
            }
        }

        return document.withLayers(images, sprites);
    }

    /**
     * Acquires rasters, then synthesizes.
     */
    public CompletableFuture<SvgaDocument> synthesize(SvgaDocument document,
                                                      SynthesisRequest request,
                                                      BitmapProducer producer) {
        Objects.requireNonNull(document, "document");
        return acquireRasters(request, producer)
                .thenApply(rasters -> synthesize(document, request, rasters));
    }

    /**
     * Obtains the rasters a request needs.
     *
     * <p>Without a caller raster the main sprite gets a transparent image of
     * the target size. The shine raster is derived from the caller raster
     * when it has content, otherwise it is a plain highlight block.</p>
     */
    public CompletableFuture<LayerRasters> acquireRasters(SynthesisRequest request, BitmapProducer producer) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(producer, "producer");

        final int width = BitmapProducer.pixels(request.rect().width());
        final int height = BitmapProducer.pixels(request.rect().height());
        final byte[] supplied = request.raster().orElse(null);

        final CompletableFuture<byte[]> main = (supplied != null)
                ? CompletableFuture.completedFuture(supplied)
                : producer.transparent(width, height);

        final CompletableFuture<byte[]> shine;
        if (request.has(AnimationPreset.SHINE)) {
            final byte[] source = (supplied != null && supplied.length > 0) ? supplied : null;
            shine = producer.shine(source, width, height);
        } else {
            shine = CompletableFuture.completedFuture(null);
        }

        return main.thenCombine(shine, LayerRasters::new);
    }
}

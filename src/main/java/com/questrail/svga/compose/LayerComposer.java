package com.questrail.svga.compose;

import com.questrail.svga.codec.SvgaEncoder;
import com.questrail.svga.internal.keys.ImageAssets;
import com.questrail.svga.model.ImageAsset;
import com.questrail.svga.model.RawImage;
import com.questrail.svga.model.SvgaDocument;
import com.questrail.svga.observability.RepairKind;
import com.questrail.svga.observability.SvgaObservabilitySink;
import com.questrail.svga.observability.SvgaRepairEvent;
import com.questrail.svga.raster.BitmapProducer;
import com.questrail.svga.synth.LayerSynthesizer;
import com.questrail.svga.synth.SynthesisRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * LayerComposer
 * =============================================================================
 * Turns a decoded document plus the user's layers into an exported container.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>Apply the viewBox override, if any</li>
 *   <li>For each layer in creation order: produce its raster (text rendered,
 *       image fitted, key none) and synthesize it into the document</li>
 *   <li>Re-encode every image as 32-bit ARGB PNG</li>
 *   <li>Encode the container</li>
 * </ol>
 *
 * <p>Layers are applied strictly one after another so later layers see the
 * keys added by earlier ones. Encoding failures complete the returned future
 * exceptionally.</p>
 */
public final class LayerComposer
{
    private final LayerSynthesizer synthesizer;
    private final BitmapProducer producer;
    private final SvgaEncoder encoder;
    private final SvgaObservabilitySink sink;

    public LayerComposer(LayerSynthesizer synthesizer,
                         BitmapProducer producer,
                         SvgaEncoder encoder,
                         SvgaObservabilitySink sink) {
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.producer = Objects.requireNonNull(producer, "producer");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Applies every layer and normalizes the images, without encoding.
     */
    public CompletableFuture<SvgaDocument> compose(SvgaDocument document,
                                                   List<EditorLayer> layers,
                                                   ExportOptions options) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(layers, "layers");
        Objects.requireNonNull(options, "options");

        final SvgaDocument start = options.viewBoxOverride()
                .map(box -> document.withParams(document.params().withViewBox(box.width(), box.height())))
                .orElse(document);

        CompletableFuture<SvgaDocument> current = CompletableFuture.completedFuture(start);
        for (EditorLayer layer : List.copyOf(layers)) {
            current = current.thenCompose(doc -> apply(doc, layer));
        }
        return current.thenCompose(this::normalizeImages);
    }

    /**
     * Composes, then encodes and names the result.
     */
    public CompletableFuture<ExportResult> export(SvgaDocument document,
                                                  List<EditorLayer> layers,
                                                  ExportOptions options) {
        return compose(document, layers, options).thenApply(composed -> new ExportResult(
                ExportNaming.fileName(options.baseName(), options.compress()),
                encoder.encode(composed, options.compress()),
                composed));
    }

    private CompletableFuture<SvgaDocument> apply(SvgaDocument document, EditorLayer layer) {
        return layerRaster(layer).thenCompose(raster -> {
            SynthesisRequest.Builder request = SynthesisRequest.builder()
                    .withRect(layer.rect())
                    .withKeyName(layer.name())
                    .withPresets(layer.presets())
                    .withConfig(layer.config());
            if (raster != null) {
                request.withRaster(raster);
            }
            return synthesizer.synthesize(document, request.build(), producer);
        });
    }

    private CompletableFuture<byte[]> layerRaster(EditorLayer layer) {
        final int width = BitmapProducer.pixels(layer.rect().width());
        final int height = BitmapProducer.pixels(layer.rect().height());
        switch (layer.kind()) {
            case TEXT:
                return producer.renderText(layer.textStyle().orElseThrow(), width, height);
            case IMAGE:
                Optional<byte[]> image = layer.image();
                return image.isPresent()
                        ? producer.fitImage(image.get(), width, height)
                        : CompletableFuture.completedFuture(null);
            case KEY:
            default:
                return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * Re-encodes every decodable image; assets that cannot be decoded are
     * left for the encoder to repair.
     */
    CompletableFuture<SvgaDocument> normalizeImages(SvgaDocument document) {
        final List<String> keys = new ArrayList<>(document.images().keySet());
        final List<CompletableFuture<ImageAsset>> pending = new ArrayList<>(keys.size());

        for (String key : keys) {
            final ImageAsset asset = document.images().get(key);
            pending.add(ImageAssets.bytes(asset)
                    .map(bytes -> producer.normalize(bytes).handle((normalized, failure) -> {
                        if (failure != null) {
                            sink.onRepair(SvgaRepairEvent.now(RepairKind.INVALID_RASTER_DATA, key,
                                    "PNG normalization failed, original bytes kept: " + failure.getMessage()));
                            return asset;
                        }
                        return (ImageAsset) new RawImage(normalized);
                    }))
                    .orElseGet(() -> CompletableFuture.completedFuture(asset)));
        }

        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).thenApply(done -> {
            final Map<String, ImageAsset> images = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                images.put(keys.get(i), pending.get(i).join());
            }
            return document.withImages(images);
        });
    }
}

package com.questrail.svga.internal.sanitize;

import com.questrail.svga.config.SvgaCodecConfig;
import com.questrail.svga.internal.keys.KeyRegistry;
import com.questrail.svga.model.AudioEntity;
import com.questrail.svga.model.EllipseArgs;
import com.questrail.svga.model.FrameEntity;
import com.questrail.svga.model.MovieParams;
import com.questrail.svga.model.PathArgs;
import com.questrail.svga.model.RectArgs;
import com.questrail.svga.model.ShapeArgs;
import com.questrail.svga.model.ShapeEntity;
import com.questrail.svga.model.ShapeStyle;
import com.questrail.svga.model.ShapeType;
import com.questrail.svga.model.SpriteEntity;
import com.questrail.svga.model.SvgaDocument;
import com.questrail.svga.observability.RepairKind;
import com.questrail.svga.observability.SvgaObservabilitySink;
import com.questrail.svga.observability.SvgaRepairEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DocumentSanitizer
 * =============================================================================
 * Produces the normalized form of a document that the encoder serializes.
 *
 * <h2>What this does</h2>
 * <ul>
 *   <li>Resolves every asset to raw bytes and sanitizes its key</li>
 *   <li>Remaps and repairs every sprite image/matte reference</li>
 *   <li>Rebuilds every frame, layout, transform and shape under {@link FieldPolicy}</li>
 *   <li>Rewrites data-less path shapes as {@link ShapeType#KEEP}</li>
 *   <li>Pins the output version and fills missing movie parameters</li>
 * </ul>
 *
 * <p>Sanitizing is idempotent: {@code sanitize(sanitize(d)).equals(sanitize(d))}.</p>
 */
public final class DocumentSanitizer
{
    private final SvgaCodecConfig config;
    private final SvgaObservabilitySink sink;

    public DocumentSanitizer(SvgaCodecConfig config, SvgaObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public SvgaDocument sanitize(SvgaDocument document) {
        Objects.requireNonNull(document, "document");

        final KeyRegistry keys = KeyRegistry.register(document.images(), sink);
        final ShapeCounter reclassified = new ShapeCounter();

        final List<SpriteEntity> sprites = new ArrayList<>(document.sprites().size());
        for (int i = 0; i < document.sprites().size(); i++) {
            sprites.add(sprite(document.sprites().get(i), i, keys, reclassified));
        }

        final List<AudioEntity> audios = new ArrayList<>(document.audios().size());
        for (AudioEntity audio : document.audios()) {
            audios.add(new AudioEntity(
                    keys.remap(audio.audioKey()),
                    audio.startFrame(),
                    audio.endFrame(),
                    audio.startTime(),
                    audio.totalTime()));
        }

        if (reclassified.count > 0) {
            sink.onRepair(SvgaRepairEvent.now(RepairKind.SHAPE_RECLASSIFIED, "shapes",
                    reclassified.count + " path shape(s) without path data rewritten as KEEP"));
        }

        return new SvgaDocument(
                config.outputVersion(),
                params(document.params()),
                keys.assets(),
                sprites,
                audios);
    }

    private MovieParams params(MovieParams params) {
        return new MovieParams(
                FieldPolicy.safe(params.viewBoxWidth(), config.fallbackViewBox()),
                FieldPolicy.safe(params.viewBoxHeight(), config.fallbackViewBox()),
                params.fps() == 0 ? config.fallbackFps() : params.fps(),
                Math.max(0, params.frames()));
    }

    private static SpriteEntity sprite(SpriteEntity sprite, int index, KeyRegistry keys, ShapeCounter counter) {
        final String owner = "sprite #" + index;
        final String imageKey = keys.resolve(sprite.imageKey(), owner);
        final String matteKey = keys.resolve(sprite.matteKey(), owner + " (matte)");

        final List<FrameEntity> frames = new ArrayList<>(sprite.frames().size());
        for (FrameEntity frame : sprite.frames()) {
            frames.add(frame(frame, counter));
        }
        return new SpriteEntity(imageKey, matteKey, frames);
    }

    static FrameEntity frame(FrameEntity frame, ShapeCounter counter) {
        final List<ShapeEntity> shapes = new ArrayList<>(frame.shapes().size());
        for (ShapeEntity shape : frame.shapes()) {
            shapes.add(shape(shape, counter));
        }
        return new FrameEntity(
                FieldPolicy.alpha(frame.alpha()),
                FieldPolicy.layout(frame.layout()),
                FieldPolicy.transform(frame.transform()),
                frame.clipPath(),
                shapes);
    }

    static ShapeEntity shape(ShapeEntity shape, ShapeCounter counter) {
        ShapeType type = shape.type();
        if (type == ShapeType.SHAPE && !hasPathData(shape.args())) {
            type = ShapeType.KEEP;
            counter.count++;
        }
        return new ShapeEntity(
                type,
                args(shape.args()),
                style(shape.style()),
                shape.transform() == null ? null : FieldPolicy.transform(shape.transform()));
    }

    private static boolean hasPathData(ShapeArgs args) {
        return args instanceof PathArgs path && !path.isEmpty();
    }

    private static ShapeArgs args(ShapeArgs args) {
        if (args instanceof PathArgs path) {
            return new PathArgs(path.d());
        }
        if (args instanceof RectArgs rect) {
            return FieldPolicy.rect(rect);
        }
        if (args instanceof EllipseArgs ellipse) {
            return FieldPolicy.ellipse(ellipse);
        }
        return null;
    }

    private static ShapeStyle style(ShapeStyle style) {
        if (style == null) {
            return null;
        }
        final List<Float> dash = new ArrayList<>(style.lineDash().size());
        for (Float value : style.lineDash()) {
            dash.add(FieldPolicy.safe(value));
        }
        return new ShapeStyle(
                FieldPolicy.color(style.fill()),
                FieldPolicy.color(style.stroke()),
                FieldPolicy.safe(style.strokeWidth()),
                style.lineCap(),
                style.lineJoin(),
                FieldPolicy.safe(style.miterLimit()),
                dash);
    }

    /** Mutable tally of shapes rewritten during one pass. */
    static final class ShapeCounter {
        int count;
    }
}

package com.questrail.svga.internal.convert;

import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.DynamicMessage;
import com.questrail.svga.internal.keys.FallbackAsset;
import com.questrail.svga.internal.keys.ImageAssets;
import com.questrail.svga.model.AudioEntity;
import com.questrail.svga.model.EllipseArgs;
import com.questrail.svga.model.FrameEntity;
import com.questrail.svga.model.Layout;
import com.questrail.svga.model.MovieParams;
import com.questrail.svga.model.PathArgs;
import com.questrail.svga.model.RectArgs;
import com.questrail.svga.model.RgbaColor;
import com.questrail.svga.model.ShapeArgs;
import com.questrail.svga.model.ShapeEntity;
import com.questrail.svga.model.ShapeStyle;
import com.questrail.svga.model.SpriteEntity;
import com.questrail.svga.model.SvgaDocument;
import com.questrail.svga.model.Transform;
import com.questrail.svga.schema.SvgaSchema;

import java.util.Objects;

/**
 * MovieWriter
 * =============================================================================
 * Converts an already-normalized {@link SvgaDocument} into a
 * {@code MovieEntity} message.
 *
 * <p>This class performs no normalization of its own. Zero scalars are
 * dropped from the wire by proto3 rules; the sanitizer is responsible for
 * the fields that must stay present.</p>
 *
 * <p>Frame layout and transform are always written; shape style, shape
 * transform and shape args only when present.</p>
 */
public final class MovieWriter
{
    private final SvgaSchema schema;

    public MovieWriter(SvgaSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public DynamicMessage write(SvgaDocument document) {
        final Descriptor movie = schema.movieEntity();
        final DynamicMessage.Builder builder = DynamicMessage.newBuilder(movie)
                .setField(movie.findFieldByName("version"), document.version())
                .setField(movie.findFieldByName("params"), params(document.params()));

        final FieldDescriptor images = movie.findFieldByName("images");
        final Descriptor entry = images.getMessageType();
        document.images().forEach((key, asset) -> {
            final byte[] bytes = ImageAssets.bytes(asset).orElseGet(FallbackAsset::png);
            builder.addRepeatedField(images, DynamicMessage.newBuilder(entry)
                    .setField(entry.findFieldByName("key"), key)
                    .setField(entry.findFieldByName("value"), ByteString.copyFrom(bytes))
                    .build());
        });

        final FieldDescriptor sprites = movie.findFieldByName("sprites");
        for (SpriteEntity sprite : document.sprites()) {
            builder.addRepeatedField(sprites, sprite(sprite));
        }

        final FieldDescriptor audios = movie.findFieldByName("audios");
        for (AudioEntity audio : document.audios()) {
            builder.addRepeatedField(audios, audio(audio));
        }
        return builder.build();
    }

    private DynamicMessage params(MovieParams params) {
        final Descriptor type = schema.message("MovieParams");
        return DynamicMessage.newBuilder(type)
                .setField(type.findFieldByName("viewBoxWidth"), params.viewBoxWidth())
                .setField(type.findFieldByName("viewBoxHeight"), params.viewBoxHeight())
                .setField(type.findFieldByName("fps"), params.fps())
                .setField(type.findFieldByName("frames"), params.frames())
                .build();
    }

    private DynamicMessage audio(AudioEntity audio) {
        final Descriptor type = schema.message("AudioEntity");
        return DynamicMessage.newBuilder(type)
                .setField(type.findFieldByName("audioKey"), audio.audioKey())
                .setField(type.findFieldByName("startFrame"), audio.startFrame())
                .setField(type.findFieldByName("endFrame"), audio.endFrame())
                .setField(type.findFieldByName("startTime"), audio.startTime())
                .setField(type.findFieldByName("totalTime"), audio.totalTime())
                .build();
    }

    private DynamicMessage sprite(SpriteEntity sprite) {
        final Descriptor type = schema.message("SpriteEntity");
        final DynamicMessage.Builder builder = DynamicMessage.newBuilder(type)
                .setField(type.findFieldByName("imageKey"), sprite.imageKey())
                .setField(type.findFieldByName("matteKey"), sprite.matteKey());
        final FieldDescriptor frames = type.findFieldByName("frames");
        for (FrameEntity frame : sprite.frames()) {
            builder.addRepeatedField(frames, frame(frame));
        }
        return builder.build();
    }

    private DynamicMessage frame(FrameEntity frame) {
        final Descriptor type = schema.message("FrameEntity");
        final DynamicMessage.Builder builder = DynamicMessage.newBuilder(type)
                .setField(type.findFieldByName("alpha"), frame.alpha())
                .setField(type.findFieldByName("layout"), layout(frame.layout()))
                .setField(type.findFieldByName("transform"), transform(frame.transform()))
                .setField(type.findFieldByName("clipPath"), frame.clipPath());
        final FieldDescriptor shapes = type.findFieldByName("shapes");
        for (ShapeEntity shape : frame.shapes()) {
            builder.addRepeatedField(shapes, shape(shape));
        }
        return builder.build();
    }

    private DynamicMessage layout(Layout layout) {
        final Descriptor type = schema.message("Layout");
        return DynamicMessage.newBuilder(type)
                .setField(type.findFieldByName("x"), layout.x())
                .setField(type.findFieldByName("y"), layout.y())
                .setField(type.findFieldByName("width"), layout.width())
                .setField(type.findFieldByName("height"), layout.height())
                .build();
    }

    private DynamicMessage transform(Transform transform) {
        final Descriptor type = schema.message("Transform");
        return DynamicMessage.newBuilder(type)
                .setField(type.findFieldByName("a"), transform.a())
                .setField(type.findFieldByName("b"), transform.b())
                .setField(type.findFieldByName("c"), transform.c())
                .setField(type.findFieldByName("d"), transform.d())
                .setField(type.findFieldByName("tx"), transform.tx())
                .setField(type.findFieldByName("ty"), transform.ty())
                .build();
    }

    private DynamicMessage shape(ShapeEntity shape) {
        final Descriptor type = schema.message("ShapeEntity");
        final FieldDescriptor typeField = type.findFieldByName("type");
        final DynamicMessage.Builder builder = DynamicMessage.newBuilder(type)
                .setField(typeField, typeField.getEnumType().findValueByNumber(shape.type().wireValue()));

        final ShapeArgs args = shape.args();
        if (args instanceof PathArgs path) {
            builder.setField(type.findFieldByName("shape"), pathArgs(path));
        }
        else if (args instanceof RectArgs rect) {
            builder.setField(type.findFieldByName("rect"), rectArgs(rect));
        }
        else if (args instanceof EllipseArgs ellipse) {
            builder.setField(type.findFieldByName("ellipse"), ellipseArgs(ellipse));
        }

        if (shape.style() != null) {
            builder.setField(type.findFieldByName("styles"), style(shape.style()));
        }
        if (shape.transform() != null) {
            builder.setField(type.findFieldByName("transform"), transform(shape.transform()));
        }
        return builder.build();
    }

    private DynamicMessage pathArgs(PathArgs path) {
        final Descriptor type = schema.message("ShapeEntity.ShapeArgs");
        return DynamicMessage.newBuilder(type)
                .setField(type.findFieldByName("d"), path.d())
                .build();
    }

    private DynamicMessage rectArgs(RectArgs rect) {
        final Descriptor type = schema.message("ShapeEntity.RectArgs");
        return DynamicMessage.newBuilder(type)
                .setField(type.findFieldByName("x"), rect.x())
                .setField(type.findFieldByName("y"), rect.y())
                .setField(type.findFieldByName("width"), rect.width())
                .setField(type.findFieldByName("height"), rect.height())
                .setField(type.findFieldByName("cornerRadius"), rect.cornerRadius())
                .build();
    }

    private DynamicMessage ellipseArgs(EllipseArgs ellipse) {
        final Descriptor type = schema.message("ShapeEntity.EllipseArgs");
        return DynamicMessage.newBuilder(type)
                .setField(type.findFieldByName("x"), ellipse.x())
                .setField(type.findFieldByName("y"), ellipse.y())
                .setField(type.findFieldByName("radiusX"), ellipse.radiusX())
                .setField(type.findFieldByName("radiusY"), ellipse.radiusY())
                .build();
    }

    private DynamicMessage style(ShapeStyle style) {
        final Descriptor type = schema.message("ShapeEntity.ShapeStyle");
        final FieldDescriptor lineCap = type.findFieldByName("lineCap");
        final FieldDescriptor lineJoin = type.findFieldByName("lineJoin");
        final DynamicMessage.Builder builder = DynamicMessage.newBuilder(type)
                .setField(type.findFieldByName("strokeWidth"), style.strokeWidth())
                .setField(lineCap, lineCap.getEnumType().findValueByNumber(style.lineCap().wireValue()))
                .setField(lineJoin, lineJoin.getEnumType().findValueByNumber(style.lineJoin().wireValue()))
                .setField(type.findFieldByName("miterLimit"), style.miterLimit());
        if (style.fill() != null) {
            builder.setField(type.findFieldByName("fill"), color(style.fill()));
        }
        if (style.stroke() != null) {
            builder.setField(type.findFieldByName("stroke"), color(style.stroke()));
        }
        final FieldDescriptor lineDash = type.findFieldByName("lineDash");
        for (Float value : style.lineDash()) {
            builder.addRepeatedField(lineDash, value);
        }
        return builder.build();
    }

    private DynamicMessage color(RgbaColor color) {
        final Descriptor type = schema.message("ShapeEntity.ShapeStyle.RGBAColor");
        return DynamicMessage.newBuilder(type)
                .setField(type.findFieldByName("r"), color.r())
                .setField(type.findFieldByName("g"), color.g())
                .setField(type.findFieldByName("b"), color.b())
                .setField(type.findFieldByName("a"), color.a())
                .build();
    }
}

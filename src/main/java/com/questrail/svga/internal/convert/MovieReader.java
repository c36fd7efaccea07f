package com.questrail.svga.internal.convert;

import com.google.protobuf.Message;
import com.questrail.svga.model.AudioEntity;
import com.questrail.svga.model.Base64Image;
import com.questrail.svga.model.EllipseArgs;
import com.questrail.svga.model.FrameEntity;
import com.questrail.svga.model.ImageAsset;
import com.questrail.svga.model.Layout;
import com.questrail.svga.model.LineCap;
import com.questrail.svga.model.LineJoin;
import com.questrail.svga.model.MovieParams;
import com.questrail.svga.model.PathArgs;
import com.questrail.svga.model.RectArgs;
import com.questrail.svga.model.RgbaColor;
import com.questrail.svga.model.ShapeArgs;
import com.questrail.svga.model.ShapeEntity;
import com.questrail.svga.model.ShapeStyle;
import com.questrail.svga.model.ShapeType;
import com.questrail.svga.model.SpriteEntity;
import com.questrail.svga.model.SvgaDocument;
import com.questrail.svga.model.Transform;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.questrail.svga.internal.convert.MessageFields.*;

/**
 * MovieReader
 * =============================================================================
 * Converts a parsed {@code MovieEntity} message into an {@link SvgaDocument}.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>Unset scalars take their proto3 default (zero, empty string, first enum value)</li>
 *   <li>A frame without layout gets {@link Layout#ZERO}</li>
 *   <li>A frame without transform gets {@link Transform#IDENTITY}</li>
 *   <li>Shape style, shape transform and shape args stay absent when unset</li>
 * </ul>
 *
 * <p>Asset bytes are carried as base64 text.</p>
 */
public final class MovieReader
{
    public SvgaDocument read(Message movie) {
        final Message params = messageOrNull(movie, "params");

        final Map<String, ImageAsset> images = new LinkedHashMap<>();
        for (Message entry : messages(movie, "images")) {
            images.put(stringValue(entry, "key"),
                    new Base64Image(Base64.getEncoder().encodeToString(bytesValue(entry, "value").toByteArray())));
        }

        final List<SpriteEntity> sprites = new ArrayList<>();
        for (Message sprite : messages(movie, "sprites")) {
            sprites.add(sprite(sprite));
        }

        final List<AudioEntity> audios = new ArrayList<>();
        for (Message audio : messages(movie, "audios")) {
            audios.add(new AudioEntity(
                    stringValue(audio, "audioKey"),
                    intValue(audio, "startFrame"),
                    intValue(audio, "endFrame"),
                    intValue(audio, "startTime"),
                    intValue(audio, "totalTime")));
        }

        return new SvgaDocument(
                stringValue(movie, "version"),
                params == null ? MovieParams.EMPTY : params(params),
                images,
                sprites,
                audios);
    }

    private static MovieParams params(Message params) {
        return new MovieParams(
                floatValue(params, "viewBoxWidth"),
                floatValue(params, "viewBoxHeight"),
                intValue(params, "fps"),
                intValue(params, "frames"));
    }

    private static SpriteEntity sprite(Message sprite) {
        final List<FrameEntity> frames = new ArrayList<>();
        for (Message frame : messages(sprite, "frames")) {
            frames.add(frame(frame));
        }
        return new SpriteEntity(
                stringValue(sprite, "imageKey"),
                stringValue(sprite, "matteKey"),
                frames);
    }

    private static FrameEntity frame(Message frame) {
        final Message layout = messageOrNull(frame, "layout");
        final Message transform = messageOrNull(frame, "transform");

        final List<ShapeEntity> shapes = new ArrayList<>();
        for (Message shape : messages(frame, "shapes")) {
            shapes.add(shape(shape));
        }

        return new FrameEntity(
                floatValue(frame, "alpha"),
                layout == null ? Layout.ZERO : layout(layout),
                transform == null ? Transform.IDENTITY : transform(transform),
                stringValue(frame, "clipPath"),
                shapes);
    }

    private static Layout layout(Message layout) {
        return new Layout(
                floatValue(layout, "x"),
                floatValue(layout, "y"),
                floatValue(layout, "width"),
                floatValue(layout, "height"));
    }

    private static Transform transform(Message transform) {
        return new Transform(
                floatValue(transform, "a"),
                floatValue(transform, "b"),
                floatValue(transform, "c"),
                floatValue(transform, "d"),
                floatValue(transform, "tx"),
                floatValue(transform, "ty"));
    }

    private static ShapeEntity shape(Message shape) {
        final Message styles = messageOrNull(shape, "styles");
        final Message transform = messageOrNull(shape, "transform");
        return new ShapeEntity(
                ShapeType.fromWire(enumNumber(shape, "type")),
                args(shape),
                styles == null ? null : style(styles),
                transform == null ? null : transform(transform));
    }

    private static ShapeArgs args(Message shape) {
        final Message path = messageOrNull(shape, "shape");
        if (path != null) {
            return new PathArgs(stringValue(path, "d"));
        }
        final Message rect = messageOrNull(shape, "rect");
        if (rect != null) {
            return new RectArgs(
                    floatValue(rect, "x"),
                    floatValue(rect, "y"),
                    floatValue(rect, "width"),
                    floatValue(rect, "height"),
                    floatValue(rect, "cornerRadius"));
        }
        final Message ellipse = messageOrNull(shape, "ellipse");
        if (ellipse != null) {
            return new EllipseArgs(
                    floatValue(ellipse, "x"),
                    floatValue(ellipse, "y"),
                    floatValue(ellipse, "radiusX"),
                    floatValue(ellipse, "radiusY"));
        }
        return null;
    }

    private static ShapeStyle style(Message style) {
        final Message fill = messageOrNull(style, "fill");
        final Message stroke = messageOrNull(style, "stroke");
        return new ShapeStyle(
                fill == null ? null : color(fill),
                stroke == null ? null : color(stroke),
                floatValue(style, "strokeWidth"),
                LineCap.fromWire(enumNumber(style, "lineCap")),
                LineJoin.fromWire(enumNumber(style, "lineJoin")),
                floatValue(style, "miterLimit"),
                floats(style, "lineDash"));
    }

    private static RgbaColor color(Message color) {
        return new RgbaColor(
                floatValue(color, "r"),
                floatValue(color, "g"),
                floatValue(color, "b"),
                floatValue(color, "a"));
    }
}

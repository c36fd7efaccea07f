package com.questrail.svga.schema;

import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumValueDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Label;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Type;
import com.google.protobuf.DescriptorProtos.FieldOptions;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.MessageOptions;
import com.google.protobuf.DescriptorProtos.OneofDescriptorProto;
import com.google.protobuf.Descriptors.DescriptorValidationException;
import com.google.protobuf.Descriptors.FileDescriptor;
import com.questrail.svga.codec.DependencyUnavailableException;

import java.util.function.Supplier;

/**
 * SvgaSchemaRegistry
 * =============================================================================
 * Builds the SVGA 2.0 wire schema against the protocol-buffer runtime.
 *
 * <h2>Field numbering</h2>
 * <p>Field ids follow the published SVGA-Format {@code svga.proto}. The legacy
 * numbering that placed shape styles at 3/4 (clashing with the rect/ellipse
 * arguments) is not supported.</p>
 *
 * <h2>Repeated numerics</h2>
 * <p>{@code ShapeStyle.lineDash} is declared with {@code packed = false}.
 * Native iOS/Android/Flutter players read only the unpacked encoding.</p>
 *
 * <h2>Lifecycle</h2>
 * <p>{@link #shared()} builds the schema once per class loader and hands the
 * same instance to every caller afterwards. {@link #load()} always builds a
 * fresh one.</p>
 */
public final class SvgaSchemaRegistry
{
    /** Protobuf package of every SVGA message. */
    public static final String PACKAGE = "com.opensource.svga";

    private static final String PREFIX = "." + PACKAGE + ".";

    private SvgaSchemaRegistry() {}

    /**
     * Returns the process-wide schema, building it on first use.
     *
     * @throws DependencyUnavailableException if the protobuf runtime rejects
     *         or cannot build the schema
     */
    public static SvgaSchema shared() {
        return Holder.INSTANCE.get();
    }

    /**
     * Builds a new schema instance.
     *
     * @throws DependencyUnavailableException if the protobuf runtime rejects
     *         or cannot build the schema
     */
    public static SvgaSchema load() {
        return load(SvgaSchemaRegistry::fileProto);
    }

    static SvgaSchema load(FileDescriptorProto proto) {
        return load(() -> proto);
    }

    static SvgaSchema load(Supplier<FileDescriptorProto> proto) {
        try {
            FileDescriptor file = FileDescriptor.buildFrom(proto.get(), new FileDescriptor[0]);
            return new SvgaSchema(file);
        }
        catch (DescriptorValidationException e) {
            throw new DependencyUnavailableException("SVGA schema rejected by protobuf runtime", e);
        }
        catch (LinkageError e) {
            throw new DependencyUnavailableException("Protobuf runtime not available", e);
        }
    }

    /**
     * Returns the raw {@code svga.proto} description.
     */
    public static FileDescriptorProto fileProto() {
        return FileDescriptorProto.newBuilder()
                .setName("svga.proto")
                .setPackage(PACKAGE)
                .setSyntax("proto3")
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("MovieParams")
                        .addField(scalar("viewBoxWidth", 1, Type.TYPE_FLOAT))
                        .addField(scalar("viewBoxHeight", 2, Type.TYPE_FLOAT))
                        .addField(scalar("fps", 3, Type.TYPE_INT32))
                        .addField(scalar("frames", 4, Type.TYPE_INT32)))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("SpriteEntity")
                        .addField(scalar("imageKey", 1, Type.TYPE_STRING))
                        .addField(repeated(message("frames", 2, "FrameEntity")))
                        .addField(scalar("matteKey", 3, Type.TYPE_STRING)))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("AudioEntity")
                        .addField(scalar("audioKey", 1, Type.TYPE_STRING))
                        .addField(scalar("startFrame", 2, Type.TYPE_INT32))
                        .addField(scalar("endFrame", 3, Type.TYPE_INT32))
                        .addField(scalar("startTime", 4, Type.TYPE_INT32))
                        .addField(scalar("totalTime", 5, Type.TYPE_INT32)))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("Layout")
                        .addField(scalar("x", 1, Type.TYPE_FLOAT))
                        .addField(scalar("y", 2, Type.TYPE_FLOAT))
                        .addField(scalar("width", 3, Type.TYPE_FLOAT))
                        .addField(scalar("height", 4, Type.TYPE_FLOAT)))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("Transform")
                        .addField(scalar("a", 1, Type.TYPE_FLOAT))
                        .addField(scalar("b", 2, Type.TYPE_FLOAT))
                        .addField(scalar("c", 3, Type.TYPE_FLOAT))
                        .addField(scalar("d", 4, Type.TYPE_FLOAT))
                        .addField(scalar("tx", 5, Type.TYPE_FLOAT))
                        .addField(scalar("ty", 6, Type.TYPE_FLOAT)))
                .addMessageType(shapeEntity())
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("FrameEntity")
                        .addField(scalar("alpha", 1, Type.TYPE_FLOAT))
                        .addField(message("layout", 2, "Layout"))
                        .addField(message("transform", 3, "Transform"))
                        .addField(scalar("clipPath", 4, Type.TYPE_STRING))
                        .addField(repeated(message("shapes", 5, "ShapeEntity"))))
                .addMessageType(movieEntity())
                .build();
    }

    private static DescriptorProto shapeEntity() {
        return DescriptorProto.newBuilder()
                .setName("ShapeEntity")
                .addEnumType(enumType("ShapeType", "SHAPE", "RECT", "ELLIPSE", "KEEP"))
                .addNestedType(DescriptorProto.newBuilder()
                        .setName("ShapeArgs")
                        .addField(scalar("d", 1, Type.TYPE_STRING)))
                .addNestedType(DescriptorProto.newBuilder()
                        .setName("RectArgs")
                        .addField(scalar("x", 1, Type.TYPE_FLOAT))
                        .addField(scalar("y", 2, Type.TYPE_FLOAT))
                        .addField(scalar("width", 3, Type.TYPE_FLOAT))
                        .addField(scalar("height", 4, Type.TYPE_FLOAT))
                        .addField(scalar("cornerRadius", 5, Type.TYPE_FLOAT)))
                .addNestedType(DescriptorProto.newBuilder()
                        .setName("EllipseArgs")
                        .addField(scalar("x", 1, Type.TYPE_FLOAT))
                        .addField(scalar("y", 2, Type.TYPE_FLOAT))
                        .addField(scalar("radiusX", 3, Type.TYPE_FLOAT))
                        .addField(scalar("radiusY", 4, Type.TYPE_FLOAT)))
                .addNestedType(shapeStyle())
                .addOneofDecl(OneofDescriptorProto.newBuilder().setName("args"))
                .addField(enumField("type", 1, "ShapeEntity.ShapeType"))
                .addField(message("shape", 2, "ShapeEntity.ShapeArgs").setOneofIndex(0))
                .addField(message("rect", 3, "ShapeEntity.RectArgs").setOneofIndex(0))
                .addField(message("ellipse", 4, "ShapeEntity.EllipseArgs").setOneofIndex(0))
                .addField(message("styles", 10, "ShapeEntity.ShapeStyle"))
                .addField(message("transform", 11, "Transform"))
                .build();
    }

    private static DescriptorProto shapeStyle() {
        return DescriptorProto.newBuilder()
                .setName("ShapeStyle")
                .addNestedType(DescriptorProto.newBuilder()
                        .setName("RGBAColor")
                        .addField(scalar("r", 1, Type.TYPE_FLOAT))
                        .addField(scalar("g", 2, Type.TYPE_FLOAT))
                        .addField(scalar("b", 3, Type.TYPE_FLOAT))
                        .addField(scalar("a", 4, Type.TYPE_FLOAT)))
                .addEnumType(enumType("LineCap", "LineCap_BUTT", "LineCap_ROUND", "LineCap_SQUARE"))
                .addEnumType(enumType("LineJoin", "LineJoin_MITER", "LineJoin_ROUND", "LineJoin_BEVEL"))
                .addField(message("fill", 1, "ShapeEntity.ShapeStyle.RGBAColor"))
                .addField(message("stroke", 2, "ShapeEntity.ShapeStyle.RGBAColor"))
                .addField(scalar("strokeWidth", 3, Type.TYPE_FLOAT))
                .addField(enumField("lineCap", 4, "ShapeEntity.ShapeStyle.LineCap"))
                .addField(enumField("lineJoin", 5, "ShapeEntity.ShapeStyle.LineJoin"))
                .addField(scalar("miterLimit", 6, Type.TYPE_FLOAT))
                .addField(repeated(scalar("lineDash", 7, Type.TYPE_FLOAT))
                        .setOptions(FieldOptions.newBuilder().setPacked(false)))
                .build();
    }

    private static DescriptorProto movieEntity() {
        return DescriptorProto.newBuilder()
                .setName("MovieEntity")
                .addNestedType(DescriptorProto.newBuilder()
                        .setName("ImagesEntry")
                        .setOptions(MessageOptions.newBuilder().setMapEntry(true))
                        .addField(scalar("key", 1, Type.TYPE_STRING))
                        .addField(scalar("value", 2, Type.TYPE_BYTES)))
                .addField(scalar("version", 1, Type.TYPE_STRING))
                .addField(message("params", 2, "MovieParams"))
                .addField(repeated(message("images", 3, "MovieEntity.ImagesEntry")))
                .addField(repeated(message("sprites", 4, "SpriteEntity")))
                .addField(repeated(message("audios", 5, "AudioEntity")))
                .build();
    }

    private static FieldDescriptorProto.Builder scalar(String name, int number, Type type) {
        return FieldDescriptorProto.newBuilder()
                .setName(name)
                .setJsonName(name)
                .setNumber(number)
                .setLabel(Label.LABEL_OPTIONAL)
                .setType(type);
    }

    private static FieldDescriptorProto.Builder message(String name, int number, String typeName) {
        return scalar(name, number, Type.TYPE_MESSAGE).setTypeName(PREFIX + typeName);
    }

    private static FieldDescriptorProto.Builder enumField(String name, int number, String typeName) {
        return scalar(name, number, Type.TYPE_ENUM).setTypeName(PREFIX + typeName);
    }

    private static FieldDescriptorProto.Builder repeated(FieldDescriptorProto.Builder field) {
        return field.setLabel(Label.LABEL_REPEATED);
    }

    private static EnumDescriptorProto enumType(String name, String... values) {
        EnumDescriptorProto.Builder builder = EnumDescriptorProto.newBuilder().setName(name);
        for (int i = 0; i < values.length; i++) {
            builder.addValue(EnumValueDescriptorProto.newBuilder()
                    .setName(values[i])
                    .setNumber(i));
        }
        return builder.build();
    }

    /**
     * First caller builds, later callers observe the cached result (or the
     * cached failure).
     */
    static final class Holder {
        static final Holder INSTANCE = new Holder(SvgaSchemaRegistry::load);

        private final SvgaSchema schema;
        private final DependencyUnavailableException failure;

        Holder(Supplier<SvgaSchema> loader) {
            SvgaSchema built = null;
            DependencyUnavailableException error = null;
            try {
                built = loader.get();
            }
            catch (DependencyUnavailableException e) {
                error = e;
            }
            this.schema = built;
            this.failure = error;
        }

        SvgaSchema get() {
            if (failure != null) {
                throw new DependencyUnavailableException(failure.getMessage(), failure.getCause());
            }
            return schema;
        }
    }
}

package com.questrail.svga.schema;

import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.EnumDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Descriptors.FileDescriptor;

import java.util.Objects;

/**
 * SvgaSchema
 * -----------------------------------------------------------------------------
 * Resolved SVGA 2.0 message descriptors.
 *
 * <p>Instances are produced by {@link SvgaSchemaRegistry} and are immutable.
 * Lookups by simple name ({@code "FrameEntity"}, {@code "ShapeStyle.RGBAColor"})
 * are relative to the {@value SvgaSchemaRegistry#PACKAGE} package.</p>
 */
public final class SvgaSchema
{
    private final FileDescriptor file;

    SvgaSchema(FileDescriptor file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public FileDescriptor file() {
        return file;
    }

    /**
     * Returns the message descriptor with the given simple (possibly nested) name.
     *
     * @throws IllegalArgumentException if no such message exists
     */
    public Descriptor message(String name) {
        final String[] path = name.split("\\.");
        Descriptor descriptor = file.findMessageTypeByName(path[0]);
        for (int i = 1; descriptor != null && i < path.length; i++) {
            descriptor = descriptor.findNestedTypeByName(path[i]);
        }
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown SVGA message: " + name);
        }
        return descriptor;
    }

    /**
     * Returns the enum descriptor nested in {@code owner} with the given name.
     */
    public EnumDescriptor enumType(String owner, String name) {
        EnumDescriptor type = message(owner).findEnumTypeByName(name);
        if (type == null) {
            throw new IllegalArgumentException("Unknown SVGA enum: " + owner + '.' + name);
        }
        return type;
    }

    /**
     * Returns a field of the named message.
     */
    public FieldDescriptor field(String message, String field) {
        FieldDescriptor descriptor = message(message).findFieldByName(field);
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown SVGA field: " + message + '.' + field);
        }
        return descriptor;
    }

    public Descriptor movieEntity() {
        return message("MovieEntity");
    }
}

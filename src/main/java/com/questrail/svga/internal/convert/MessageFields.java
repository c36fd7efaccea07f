package com.questrail.svga.internal.convert;

import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.EnumValueDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed accessors over reflective protobuf messages.
 *
 * <p>Unset proto3 scalars read as their declared default, which is how the
 * decoder keeps defaults explicit.</p>
 */
final class MessageFields
{
    private MessageFields() {}

    static FieldDescriptor field(Message message, String name) {
        FieldDescriptor field = message.getDescriptorForType().findFieldByName(name);
        if (field == null) {
            throw new IllegalArgumentException(
                    message.getDescriptorForType().getName() + " has no field " + name);
        }
        return field;
    }

    static float floatValue(Message message, String name) {
        return (Float) message.getField(field(message, name));
    }

    static int intValue(Message message, String name) {
        return (Integer) message.getField(field(message, name));
    }

    static String stringValue(Message message, String name) {
        return (String) message.getField(field(message, name));
    }

    static ByteString bytesValue(Message message, String name) {
        return (ByteString) message.getField(field(message, name));
    }

    static int enumNumber(Message message, String name) {
        return ((EnumValueDescriptor) message.getField(field(message, name))).getNumber();
    }

    /**
     * Returns the sub-message, or {@code null} if it is not set.
     */
    static Message messageOrNull(Message message, String name) {
        FieldDescriptor field = field(message, name);
        return message.hasField(field) ? (Message) message.getField(field) : null;
    }

    static List<Message> messages(Message message, String name) {
        FieldDescriptor field = field(message, name);
        int count = message.getRepeatedFieldCount(field);
        List<Message> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add((Message) message.getRepeatedField(field, i));
        }
        return out;
    }

    static List<Float> floats(Message message, String name) {
        FieldDescriptor field = field(message, name);
        int count = message.getRepeatedFieldCount(field);
        List<Float> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add((Float) message.getRepeatedField(field, i));
        }
        return out;
    }
}

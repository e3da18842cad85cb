package org.irlens.ir.schema;

import org.irlens.path.Segment;

import java.util.Objects;

/**
 * Declares one field of a node kind.
 *
 * @param name The field name.
 * @param role How the field takes part in comparison and printing.
 */
public record FieldDescriptor(String name, FieldRole role) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
    }

    public static FieldDescriptor child(String name) {
        return new FieldDescriptor(name, FieldRole.CHILD);
    }

    public static FieldDescriptor binder(String name) {
        return new FieldDescriptor(name, FieldRole.BINDER);
    }

    public static FieldDescriptor attribute(String name) {
        return new FieldDescriptor(name, FieldRole.ATTRIBUTE);
    }

    public static FieldDescriptor nameHint(String name) {
        return new FieldDescriptor(name, FieldRole.NAME_HINT);
    }

    public static FieldDescriptor metadata(String name) {
        return new FieldDescriptor(name, FieldRole.METADATA);
    }

    /**
     * @return The path segment that enters this field.
     */
    public Segment segment() {
        return role == FieldRole.ATTRIBUTE ? new Segment.Attr(name) : new Segment.Field(name);
    }
}

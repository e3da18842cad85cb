package org.irlens.path;

import org.irlens.ir.IrNode;
import org.irlens.ir.IrNodes;

import java.util.Objects;

/**
 * One step of a {@link NodePath}.
 */
public sealed interface Segment permits Segment.Field, Segment.Index, Segment.Key, Segment.Attr {

    /**
     * Enter a named field of a composite node.
     * @param name The field name.
     */
    record Field(String name) implements Segment {
        public Field {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return "." + name;
        }
    }

    /**
     * Enter position {@code index} of a sequence.
     * @param index The zero-based position.
     */
    record Index(int index) implements Segment {
        public Index {
            if (index < 0) throw new IllegalArgumentException("Negative index: " + index);
        }

        @Override
        public String toString() {
            return "[" + index + "]";
        }
    }

    /**
     * Enter the value stored under {@code key} in a mapping. Two key segments are equal when
     * their keys are structurally equal, so a path keeps its meaning after serialization.
     * @param key The key node.
     */
    record Key(IrNode key) implements Segment {
        public Key {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key other)) return false;
            return IrNodes.structurallyEqual(key, other.key);
        }

        @Override
        public int hashCode() {
            return IrNodes.structuralHash(key);
        }

        @Override
        public String toString() {
            return "[" + IrNodes.describe(key) + "]";
        }
    }

    /**
     * Logical attribute alias of a composite field, e.g. {@code .value} on a boxed scalar.
     * Resolves exactly like a {@link Field}.
     * @param name The attribute name.
     */
    record Attr(String name) implements Segment {
        public Attr {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return "." + name;
        }
    }
}

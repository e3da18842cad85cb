package org.irlens.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The base interface for all nodes of an IR tree.
 * <p>
 * Nodes are immutable and allocated by an {@link IrArena}, which assigns each one a
 * stable {@link NodeHandle}. Equality is identity: two nodes are equal only if they are the
 * same allocation. Structural equality is a separate question answered by
 * {@link IrNodes#structurallyEqual(IrNode, IrNode)} or the structural comparator.
 * <p>
 * A node object may appear at more than one position of a tree (a variable used at
 * several sites). That is shared reference, not ownership.
 */
public sealed interface IrNode permits IrNode.Leaf, IrNode.Composite, IrNode.Sequence, IrNode.Mapping {

    /**
     * @return The stable identity of this node.
     */
    NodeHandle handle();

    /**
     * Returns the direct children in their stored order. Mapping nodes return keys and values
     * interleaved. Leaves return an empty list.
     *
     * @return A list of child nodes.
     */
    List<IrNode> children();

    /**
     * A primitive scalar.
     */
    final class Leaf implements IrNode {
        private final NodeHandle handle;
        private final IrValue value;

        Leaf(NodeHandle handle, IrValue value) {
            this.handle = handle;
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public NodeHandle handle() {
            return handle;
        }

        public IrValue value() {
            return value;
        }

        @Override
        public List<IrNode> children() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return "Leaf" + handle + "{" + value.literal() + "}";
        }
    }

    /**
     * A tagged node with named fields, e.g. a function definition, a loop or a binding.
     * Field order as stored here is the construction order; comparison and printing use the
     * order declared by the kind's schema instead.
     */
    final class Composite implements IrNode {
        private final NodeHandle handle;
        private final String kind;
        private final Map<String, IrNode> fields;

        Composite(NodeHandle handle, String kind, Map<String, IrNode> fields) {
            this.handle = handle;
            this.kind = Objects.requireNonNull(kind, "kind");
            fields.forEach((name, value) -> Objects.requireNonNull(value, "field " + name));
            this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public NodeHandle handle() {
            return handle;
        }

        public String kind() {
            return kind;
        }

        public Map<String, IrNode> fields() {
            return fields;
        }

        public Optional<IrNode> field(String name) {
            return Optional.ofNullable(fields.get(name));
        }

        public boolean hasField(String name) {
            return fields.containsKey(name);
        }

        @Override
        public List<IrNode> children() {
            return new ArrayList<>(fields.values());
        }

        @Override
        public String toString() {
            return "Composite" + handle + "{" + kind + ", fields=" + fields.keySet() + "}";
        }
    }

    /**
     * An ordered list of nodes.
     */
    final class Sequence implements IrNode {
        private final NodeHandle handle;
        private final List<IrNode> elements;

        Sequence(NodeHandle handle, List<IrNode> elements) {
            this.handle = handle;
            this.elements = List.copyOf(elements);
        }

        @Override
        public NodeHandle handle() {
            return handle;
        }

        public List<IrNode> elements() {
            return elements;
        }

        public int size() {
            return elements.size();
        }

        public IrNode get(int index) {
            return elements.get(index);
        }

        @Override
        public List<IrNode> children() {
            return elements;
        }

        @Override
        public String toString() {
            return "Sequence" + handle + "{size=" + elements.size() + "}";
        }
    }

    /**
     * An ordered list of key/value entries. Keys are nodes themselves.
     */
    final class Mapping implements IrNode {
        private final NodeHandle handle;
        private final List<Entry> entries;

        Mapping(NodeHandle handle, List<Entry> entries) {
            this.handle = handle;
            this.entries = List.copyOf(entries);
        }

        @Override
        public NodeHandle handle() {
            return handle;
        }

        public List<Entry> entries() {
            return entries;
        }

        public int size() {
            return entries.size();
        }

        /**
         * Finds the entry for a key: first by identity, then by structural equality.
         *
         * @param key The key to look up.
         * @return The matching entry, or empty if no key matches.
         */
        public Optional<Entry> find(IrNode key) {
            for (Entry entry : entries) {
                if (entry.key() == key) return Optional.of(entry);
            }
            for (Entry entry : entries) {
                if (IrNodes.structurallyEqual(entry.key(), key)) return Optional.of(entry);
            }
            return Optional.empty();
        }

        @Override
        public List<IrNode> children() {
            List<IrNode> result = new ArrayList<>(entries.size() * 2);
            for (Entry entry : entries) {
                result.add(entry.key());
                result.add(entry.value());
            }
            return result;
        }

        @Override
        public String toString() {
            return "Mapping" + handle + "{size=" + entries.size() + "}";
        }

        /**
         * A single key/value pair of a mapping.
         * @param key The key node.
         * @param value The value node.
         */
        public record Entry(IrNode key, IrNode value) {
            public Entry {
                Objects.requireNonNull(key, "key");
                Objects.requireNonNull(value, "value");
            }
        }
    }
}

package org.irlens.path;

import org.irlens.ir.IrNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable address describing a walk from a tree's root to one node. The empty path
 * denotes the root. Paths hold no reference to any particular tree (apart from the key
 * nodes of {@link Segment.Key}, which are compared structurally) and only gain meaning
 * when resolved with {@link PathResolver}.
 * <p>
 * The string form uses dotted/bracketed notation, e.g. {@code <root>.buffer_map[b].shape[1].value}.
 */
public final class NodePath {

    private static final NodePath ROOT = new NodePath(Collections.emptyList());

    private final List<Segment> segments;

    private NodePath(List<Segment> segments) {
        this.segments = segments;
    }

    /**
     * @return The empty path addressing the root.
     */
    public static NodePath root() {
        return ROOT;
    }

    public static NodePath of(List<Segment> segments) {
        return segments.isEmpty() ? ROOT : new NodePath(List.copyOf(segments));
    }

    public static NodePath of(Segment... segments) {
        return of(List.of(segments));
    }

    public List<Segment> segments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /**
     * @return The last segment of this path.
     * @throws IllegalStateException if this is the root path.
     */
    public Segment last() {
        if (isRoot()) throw new IllegalStateException("The root path has no segments");
        return segments.get(segments.size() - 1);
    }

    public NodePath append(Segment segment) {
        List<Segment> extended = new ArrayList<>(segments.size() + 1);
        extended.addAll(segments);
        extended.add(segment);
        return new NodePath(Collections.unmodifiableList(extended));
    }

    public NodePath field(String name) {
        return append(new Segment.Field(name));
    }

    public NodePath attr(String name) {
        return append(new Segment.Attr(name));
    }

    public NodePath index(int index) {
        return append(new Segment.Index(index));
    }

    public NodePath key(IrNode key) {
        return append(new Segment.Key(key));
    }

    /**
     * @return This path without its last segment; the root is its own parent.
     */
    public NodePath parent() {
        return isRoot() ? this : prefix(segments.size() - 1);
    }

    /**
     * @param length Number of leading segments to keep.
     * @return The prefix of the given length.
     */
    public NodePath prefix(int length) {
        if (length < 0 || length > segments.size()) {
            throw new IndexOutOfBoundsException("Prefix length " + length + " out of range for " + this);
        }
        if (length == segments.size()) return this;
        return of(segments.subList(0, length));
    }

    /**
     * @param other A candidate prefix.
     * @return {@code true} if {@code other} is a prefix of (or equal to) this path.
     */
    public boolean startsWith(NodePath other) {
        return other.size() <= size() && segments.subList(0, other.size()).equals(other.segments);
    }

    /**
     * Returns this path with every {@link Segment.Attr} replaced by the {@link Segment.Field}
     * of the same name. Both resolve identically, so lookups keyed by path use this form.
     *
     * @return The normalized path.
     */
    public NodePath withFieldsOnly() {
        boolean hasAttr = false;
        for (Segment segment : segments) {
            if (segment instanceof Segment.Attr) {
                hasAttr = true;
                break;
            }
        }
        if (!hasAttr) return this;
        List<Segment> normalized = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            normalized.add(segment instanceof Segment.Attr attr ? new Segment.Field(attr.name()) : segment);
        }
        return new NodePath(Collections.unmodifiableList(normalized));
    }

    /**
     * Stricter than comparing the {@link #withFieldsOnly()} forms: key segments must hold the
     * very same key node. Two entries whose keys are structurally equal have equal paths, but
     * only one of them is the same occurrence as a given path.
     *
     * @param other The path to compare with.
     * @return {@code true} if both paths address the same position through the same key nodes.
     */
    public boolean sameOccurrence(NodePath other) {
        if (!withFieldsOnly().equals(other.withFieldsOnly())) return false;
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i) instanceof Segment.Key key
                    && key.key() != ((Segment.Key) other.segments.get(i)).key()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodePath other)) return false;
        return segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("<root>");
        for (Segment segment : segments) {
            sb.append(segment);
        }
        return sb.toString();
    }
}

package org.irlens.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Allocates IR nodes and hands out their {@link NodeHandle}s.
 * <p>
 * Every node lives in exactly one arena and is addressed by its index there. The arena is
 * used by the front end while building trees; it is not thread-safe. Trees it produced can
 * be shared read-only across threads once construction is finished.
 * <p>
 * A container is built from children that already exist and its contents are copied, so no
 * node can become its own descendant. Every tree from an arena is acyclic, and the walkers
 * in this library do not check for cycles.
 */
public final class IrArena {

    private static final AtomicInteger NEXT_ARENA_ID = new AtomicInteger();

    private final int id;
    private final List<IrNode> nodes = new ArrayList<>();

    public IrArena() {
        this.id = NEXT_ARENA_ID.incrementAndGet();
    }

    public int id() {
        return id;
    }

    /**
     * Looks up a node previously allocated by this arena.
     *
     * @param handle The handle to look up.
     * @return The node, or empty if the handle belongs to another arena or is out of range.
     */
    public Optional<IrNode> get(NodeHandle handle) {
        if (handle.arenaId() != id || handle.index() < 0 || handle.index() >= nodes.size()) {
            return Optional.empty();
        }
        return Optional.of(nodes.get(handle.index()));
    }

    /**
     * @return The number of nodes allocated so far.
     */
    public int size() {
        return nodes.size();
    }

    public IrNode.Leaf leaf(IrValue value) {
        return register(new IrNode.Leaf(nextHandle(), value));
    }

    public IrNode.Leaf intLeaf(long value) {
        return leaf(new IrValue.Int64(value));
    }

    public IrNode.Leaf floatLeaf(double value) {
        return leaf(new IrValue.Float64(value));
    }

    public IrNode.Leaf strLeaf(String value) {
        return leaf(new IrValue.Str(value));
    }

    public IrNode.Leaf boolLeaf(boolean value) {
        return leaf(new IrValue.Bool(value));
    }

    public IrNode.Leaf handleLeaf(String type, long handleId) {
        return leaf(new IrValue.Handle(type, handleId));
    }

    /**
     * Allocates a composite node. The map's iteration order is kept as the stored order.
     *
     * @param kind The kind tag.
     * @param fields The named fields.
     * @return The new node.
     */
    public IrNode.Composite composite(String kind, Map<String, IrNode> fields) {
        return register(new IrNode.Composite(nextHandle(), kind, fields));
    }

    public IrNode.Sequence sequence(List<IrNode> elements) {
        return register(new IrNode.Sequence(nextHandle(), elements));
    }

    public IrNode.Sequence sequence(IrNode... elements) {
        return sequence(Arrays.asList(elements));
    }

    public IrNode.Mapping mapping(List<IrNode.Mapping.Entry> entries) {
        return register(new IrNode.Mapping(nextHandle(), entries));
    }

    /**
     * Convenience factory for mapping entries.
     */
    public static IrNode.Mapping.Entry entry(IrNode key, IrNode value) {
        return new IrNode.Mapping.Entry(key, value);
    }

    private NodeHandle nextHandle() {
        return new NodeHandle(id, nodes.size());
    }

    private <T extends IrNode> T register(T node) {
        nodes.add(node);
        return node;
    }
}

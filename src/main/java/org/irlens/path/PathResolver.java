package org.irlens.path;

import org.irlens.api.PathNotFoundException;
import org.irlens.ir.IrNode;

import java.util.Optional;

/**
 * Resolves a {@link NodePath} against a concrete tree. Resolution is read-only and needs no
 * schema: a Field or Attr segment only requires the composite to carry that field.
 */
public final class PathResolver {

    private PathResolver() {}

    /**
     * Applies each segment of the path, starting at the root.
     *
     * @param root The tree root.
     * @param path The path to resolve.
     * @return The addressed node.
     * @throws PathNotFoundException at the first segment that cannot be applied; the exception
     *         carries the length of the prefix that did resolve.
     */
    public static IrNode resolve(IrNode root, NodePath path) throws PathNotFoundException {
        IrNode current = root;
        int resolved = 0;
        for (Segment segment : path.segments()) {
            current = step(current, segment, path, resolved);
            resolved++;
        }
        return current;
    }

    /**
     * Like {@link #resolve(IrNode, NodePath)} but reports failure as an empty result.
     */
    public static Optional<IrNode> tryResolve(IrNode root, NodePath path) {
        try {
            return Optional.of(resolve(root, path));
        } catch (PathNotFoundException e) {
            return Optional.empty();
        }
    }

    private static IrNode step(IrNode current, Segment segment, NodePath path, int resolved) throws PathNotFoundException {
        if (segment instanceof Segment.Field || segment instanceof Segment.Attr) {
            String name = segment instanceof Segment.Field field ? field.name() : ((Segment.Attr) segment).name();
            if (!(current instanceof IrNode.Composite composite)) {
                throw new PathNotFoundException(path, resolved, "expected a composite for " + segment + " but found " + shape(current));
            }
            return composite.field(name).orElseThrow(() -> new PathNotFoundException(path, resolved,
                    "'" + composite.kind() + "' has no field '" + name + "'"));
        }
        if (segment instanceof Segment.Index index) {
            if (!(current instanceof IrNode.Sequence sequence)) {
                throw new PathNotFoundException(path, resolved, "expected a sequence for " + segment + " but found " + shape(current));
            }
            if (index.index() >= sequence.size()) {
                throw new PathNotFoundException(path, resolved,
                        "index " + index.index() + " out of bounds for length " + sequence.size());
            }
            return sequence.get(index.index());
        }
        Segment.Key key = (Segment.Key) segment;
        if (!(current instanceof IrNode.Mapping mapping)) {
            throw new PathNotFoundException(path, resolved, "expected a mapping for " + segment + " but found " + shape(current));
        }
        return mapping.find(key.key())
                .map(IrNode.Mapping.Entry::value)
                .orElseThrow(() -> new PathNotFoundException(path, resolved, "no entry for key " + segment));
    }

    private static String shape(IrNode node) {
        if (node instanceof IrNode.Composite composite) return "'" + composite.kind() + "'";
        if (node instanceof IrNode.Leaf leaf) return "leaf " + leaf.value().literal();
        return node instanceof IrNode.Sequence ? "a sequence" : "a mapping";
    }
}

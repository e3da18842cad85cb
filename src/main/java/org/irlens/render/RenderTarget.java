package org.irlens.render;

import org.irlens.ir.IrNode;
import org.irlens.path.NodePath;

import java.util.Objects;

/**
 * What a render request points at: a position given by path, or a node object given by
 * identity. A path addresses exactly one occurrence; an identity addresses every position
 * at which that node object occurs.
 */
public sealed interface RenderTarget permits RenderTarget.ByPath, RenderTarget.ByIdentity {

    static RenderTarget of(NodePath path) {
        return new ByPath(path);
    }

    static RenderTarget of(IrNode node) {
        return new ByIdentity(node);
    }

    /**
     * @param path The path, resolved against the rendered root before printing.
     */
    record ByPath(NodePath path) implements RenderTarget {
        public ByPath {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public String toString() {
            return path.toString();
        }
    }

    /**
     * @param node The node object; all of its occurrences are targeted.
     */
    record ByIdentity(IrNode node) implements RenderTarget {
        public ByIdentity {
            Objects.requireNonNull(node, "node");
        }

        @Override
        public String toString() {
            return "node " + node.handle();
        }
    }
}

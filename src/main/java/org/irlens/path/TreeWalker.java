package org.irlens.path;

import org.irlens.api.MalformedTreeException;
import org.irlens.ir.IrNode;
import org.irlens.ir.schema.FieldDescriptor;
import org.irlens.ir.schema.NodeKindSchema;
import org.irlens.ir.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Walks a tree in pre-order, handing every addressable node to a handler together with the
 * {@link NodePath} that reaches it. Composite fields are visited in schema order, so the
 * paths produced here are the same ones the comparator reports and the renderer records.
 * Mapping keys are not addressable and are not visited; their values are, under a Key segment.
 */
public class TreeWalker {

    private final SchemaRegistry schemas;

    /**
     * @param schemas The schema table that fixes field order.
     */
    public TreeWalker(SchemaRegistry schemas) {
        this.schemas = schemas;
    }

    /**
     * Walks a tree.
     *
     * @param root The root node.
     * @param handler Called for every addressable node, parents before children.
     * @throws MalformedTreeException if the tree violates its schema.
     */
    public void walk(IrNode root, BiConsumer<NodePath, IrNode> handler) {
        walk(root, NodePath.root(), handler);
    }

    /**
     * Finds every position at which a node object occurs.
     *
     * @param root The root node.
     * @param target The node to look for, compared by identity.
     * @return The paths of all occurrences in pre-order; empty if the node never occurs.
     */
    public List<NodePath> occurrences(IrNode root, IrNode target) {
        List<NodePath> result = new ArrayList<>();
        walk(root, (path, node) -> {
            if (node == target) result.add(path);
        });
        return result;
    }

    private void walk(IrNode node, NodePath path, BiConsumer<NodePath, IrNode> handler) {
        handler.accept(path, node);
        if (node instanceof IrNode.Composite composite) {
            NodeKindSchema schema = schemas.validate(composite, path.toString());
            for (FieldDescriptor field : schema.fields()) {
                IrNode child = composite.fields().get(field.name());
                if (child != null) {
                    walk(child, path.append(field.segment()), handler);
                }
            }
        } else if (node instanceof IrNode.Sequence sequence) {
            for (int i = 0; i < sequence.size(); i++) {
                walk(sequence.get(i), path.index(i), handler);
            }
        } else if (node instanceof IrNode.Mapping mapping) {
            for (IrNode.Mapping.Entry entry : mapping.entries()) {
                walk(entry.value(), path.key(entry.key()), handler);
            }
        }
    }
}

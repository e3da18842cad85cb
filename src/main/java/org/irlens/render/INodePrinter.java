package org.irlens.render;

import org.irlens.ir.IrNode;

/**
 * Prints one composite node kind.
 * <p>
 * Implementations should be stateless. All output goes through the provided
 * {@link PrintContext}, which records a span for every child printed via
 * {@link PrintContext#print} or {@link PrintContext#printAs}. Fields a printer chooses not to
 * show are folded into the nearest printed ancestor.
 */
public interface INodePrinter {

    /**
     * Prints the node at the context's current position.
     *
     * @param node The node to print. Its kind has already been validated against its schema.
     * @param ctx The print context.
     */
    void print(IrNode.Composite node, PrintContext ctx);
}

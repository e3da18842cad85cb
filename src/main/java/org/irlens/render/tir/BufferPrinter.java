package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

/**
 * Prints a buffer reference by name. Shape and dtype appear only in its
 * {@code T.match_buffer} declaration.
 */
public final class BufferPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        node.field("name").ifPresentOrElse(
                name -> ctx.printName(ctx.segment(node, "name"), name),
                () -> ctx.write("buffer"));
    }
}

package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

/**
 * Prints {@code vi = T.axis.spatial(128, i)}.
 */
public final class AxisBindingPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        ctx.printField(node, "var");
        ctx.write(" = ");
        TirPrinting.qualified(ctx, node, "iter_type", "T.axis.");
        ctx.write("(");
        ctx.printField(node, "extent");
        ctx.write(", ");
        ctx.printField(node, "value");
        ctx.write(")");
    }
}

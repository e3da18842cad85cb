package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

public final class FloatImmPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        TirPrinting.qualified(ctx, node, "dtype", "T.");
        ctx.write("(");
        ctx.printField(node, "value");
        ctx.write(")");
    }
}

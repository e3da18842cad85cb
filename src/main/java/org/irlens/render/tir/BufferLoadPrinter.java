package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

public final class BufferLoadPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        ctx.printField(node, "buffer");
        TirPrinting.subscript(ctx, node, "indices");
    }
}

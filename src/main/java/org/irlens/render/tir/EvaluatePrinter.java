package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

public final class EvaluatePrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        ctx.write("T.evaluate(");
        ctx.printField(node, "value");
        ctx.write(")");
    }
}

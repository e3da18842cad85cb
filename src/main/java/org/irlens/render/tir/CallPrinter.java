package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

/**
 * Prints {@code T.op(arg, ...)}.
 */
public final class CallPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        TirPrinting.qualified(ctx, node, "op", "T.");
        ctx.write("(");
        node.field("args").ifPresent(args -> {
            if (args instanceof IrNode.Sequence seq) {
                ctx.printAs(ctx.segment(node, "args"), seq, () -> ctx.printElements(seq, ", "));
            } else {
                ctx.printField(node, "args");
            }
        });
        ctx.write(")");
    }
}

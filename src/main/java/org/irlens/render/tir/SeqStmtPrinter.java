package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

/**
 * Prints the statements of a sequence one per line; an empty sequence prints {@code pass}.
 */
public final class SeqStmtPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        IrNode seq = node.field("seq").orElse(null);
        if (seq instanceof IrNode.Sequence statements && statements.size() == 0) {
            ctx.printAs(ctx.segment(node, "seq"), statements, () -> ctx.write("pass"));
        } else if (seq != null) {
            ctx.printField(node, "seq");
        }
    }
}

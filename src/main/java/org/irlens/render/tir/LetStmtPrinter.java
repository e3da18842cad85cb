package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

/**
 * Prints {@code x: T.int32 = value} with the body continuing at the same indentation.
 */
public final class LetStmtPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        node.field("var").ifPresent(var -> TirPrinting.declaration(ctx, ctx.segment(node, "var"), var));
        ctx.write(" = ");
        ctx.printField(node, "value");
        TirPrinting.onNewLine(ctx, node, "body");
    }
}

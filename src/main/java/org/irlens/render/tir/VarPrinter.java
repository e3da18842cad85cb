package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

/**
 * Prints a variable by its name hint. The dtype is shown where the variable is declared, not
 * at its uses.
 */
public final class VarPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        node.field("name").ifPresentOrElse(
                name -> ctx.printName(ctx.segment(node, "name"), name),
                () -> ctx.write("v" + node.handle().index()));
    }
}

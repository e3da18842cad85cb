package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.ir.tir.TirBuilder;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

/**
 * Prints {@code T.int64(5)}; with syntax sugar an int32 constant prints as the bare literal,
 * folding its dtype.
 */
public final class IntImmPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        boolean bare = ctx.config().syntaxSugar()
                && TirPrinting.stringField(node, "dtype").map(TirBuilder.INT32::equals).orElse(false);
        if (bare) {
            ctx.printField(node, "value");
            return;
        }
        TirPrinting.qualified(ctx, node, "dtype", "T.");
        ctx.write("(");
        ctx.printField(node, "value");
        ctx.write(")");
    }
}

package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.ir.tir.TirKinds;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

import java.util.Optional;

/**
 * Prints a binary operator. With syntax sugar operators that have an infix symbol print as
 * {@code a + b}, parenthesizing nested infix operands; otherwise {@code T.add(a, b)}.
 */
public final class BinaryOpPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        Optional<String> symbol = TirKinds.infixSymbol(node.kind());
        if (ctx.config().syntaxSugar() && symbol.isPresent()) {
            operand(node, "a", ctx);
            ctx.write(" " + symbol.get() + " ");
            operand(node, "b", ctx);
            return;
        }
        ctx.write("T." + node.kind() + "(");
        ctx.printField(node, "a");
        ctx.write(", ");
        ctx.printField(node, "b");
        ctx.write(")");
    }

    private void operand(IrNode.Composite node, String field, PrintContext ctx) {
        IrNode value = node.field(field).orElse(null);
        boolean nested = value instanceof IrNode.Composite composite
                && TirKinds.infixSymbol(composite.kind()).isPresent();
        if (nested) ctx.write("(");
        ctx.printField(node, field);
        if (nested) ctx.write(")");
    }
}

package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.ir.tir.TirKinds;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints a loop. With syntax sugar a serial loop from zero becomes {@code range(n)}, and a
 * chain of such loops directly nested in one another becomes a single
 * {@code for i, j in T.grid(n, m):} header. The folded inner loops get no span of their
 * own; their variables and extents keep theirs.
 */
public final class ForPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        if (ctx.config().syntaxSugar()) {
            List<IrNode.Composite> chain = gridChain(node);
            if (chain.size() > 1) {
                printGrid(chain, ctx);
                return;
            }
        }
        ctx.write("for ");
        ctx.printField(node, "loop_var");
        ctx.write(" in ");
        if (ctx.config().syntaxSugar() && isRangeLoop(node)) {
            ctx.write("range(");
            ctx.printField(node, "extent");
            ctx.write(")");
        } else {
            TirPrinting.qualified(ctx, node, "kind", "T.");
            ctx.write("(");
            ctx.printField(node, "min");
            ctx.write(", ");
            ctx.printField(node, "extent");
            ctx.write(")");
        }
        ctx.write(":");
        ctx.indent();
        TirPrinting.onNewLine(ctx, node, "body");
        ctx.dedent();
    }

    private void printGrid(List<IrNode.Composite> chain, PrintContext ctx) {
        ctx.write("for ");
        for (int k = 0; k < chain.size(); k++) {
            if (k > 0) ctx.write(", ");
            IrNode.Composite loop = chain.get(k);
            inLoop(chain, k, ctx, () -> ctx.printField(loop, "loop_var"));
        }
        ctx.write(" in T.grid(");
        for (int k = 0; k < chain.size(); k++) {
            if (k > 0) ctx.write(", ");
            IrNode.Composite loop = chain.get(k);
            inLoop(chain, k, ctx, () -> ctx.printField(loop, "extent"));
        }
        ctx.write("):");
        ctx.indent();
        int last = chain.size() - 1;
        IrNode.Composite innermost = chain.get(last);
        inLoop(chain, last, ctx, () -> TirPrinting.onNewLine(ctx, innermost, "body"));
        ctx.dedent();
    }

    /**
     * Runs {@code body} with the path positioned at loop {@code depth} of the chain.
     */
    private static void inLoop(List<IrNode.Composite> chain, int depth, PrintContext ctx, Runnable body) {
        Runnable nested = body;
        for (int k = depth; k >= 1; k--) {
            IrNode.Composite parent = chain.get(k - 1);
            IrNode.Composite child = chain.get(k);
            Runnable inner = nested;
            nested = () -> ctx.fold(ctx.segment(parent, "body"), child, inner);
        }
        nested.run();
    }

    static List<IrNode.Composite> gridChain(IrNode.Composite outer) {
        List<IrNode.Composite> chain = new ArrayList<>();
        IrNode.Composite current = outer;
        while (isRangeLoop(current)) {
            chain.add(current);
            IrNode body = current.field("body").orElse(null);
            if (!(body instanceof IrNode.Composite next) || !next.kind().equals(TirKinds.FOR)) break;
            current = next;
        }
        return chain;
    }

    /**
     * @return Whether a loop is serial, starts at literal zero and can print as {@code range(n)}.
     */
    static boolean isRangeLoop(IrNode.Composite loop) {
        if (!TirPrinting.stringField(loop, "kind").map("serial"::equals).orElse(false)) return false;
        if (!loop.hasField("loop_var") || !loop.hasField("extent") || !loop.hasField("body")) return false;
        IrNode min = loop.field("min").orElse(null);
        if (!(min instanceof IrNode.Composite imm) || !imm.kind().equals(TirKinds.INT_IMM)) return false;
        return imm.field("value").flatMap(PrintContext::longValue).map(v -> v == 0L).orElse(false);
    }
}

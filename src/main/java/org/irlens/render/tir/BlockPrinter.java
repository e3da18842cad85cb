package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.ir.tir.TirKinds;
import org.irlens.path.Segment;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

/**
 * Prints {@code with T.block("name"):} followed by the axis bindings, optional block
 * attributes and the body. With syntax sugar, two or more spatial/reduce bindings to plain
 * variables collapse into one {@code vi, vj = T.axis.remap("SR", [i, j])} line; the folded
 * binding nodes and their extents then have no span.
 */
public final class BlockPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        ctx.write("with T.block(");
        ctx.printField(node, "name");
        ctx.write("):");
        ctx.indent();
        node.field("axes").ifPresent(axes -> {
            if (axes instanceof IrNode.Sequence seq) {
                if (ctx.config().syntaxSugar() && isRemappable(seq)) {
                    ctx.startLine();
                    ctx.printAs(ctx.segment(node, "axes"), seq, () -> printRemap(seq, ctx));
                } else if (seq.size() > 0) {
                    ctx.printField(node, "axes");
                }
            } else {
                TirPrinting.onNewLine(ctx, node, "axes");
            }
        });
        if (ctx.config().showMetadata() && node.hasField("annotations")) {
            ctx.startLine();
            ctx.write("T.block_attr(");
            ctx.printField(node, "annotations");
            ctx.write(")");
        }
        TirPrinting.onNewLine(ctx, node, "body");
        ctx.dedent();
    }

    private void printRemap(IrNode.Sequence axes, PrintContext ctx) {
        StringBuilder letters = new StringBuilder();
        for (int i = 0; i < axes.size(); i++) {
            if (i > 0) ctx.write(", ");
            IrNode.Composite axis = (IrNode.Composite) axes.get(i);
            ctx.fold(new Segment.Index(i), axis, () -> ctx.printField(axis, "var"));
            letters.append(TirPrinting.stringField(axis, "iter_type").map(t -> t.equals("reduce") ? "R" : "S").orElse("S"));
        }
        ctx.write(" = T.axis.remap(\"" + letters + "\", [");
        for (int i = 0; i < axes.size(); i++) {
            if (i > 0) ctx.write(", ");
            IrNode.Composite axis = (IrNode.Composite) axes.get(i);
            ctx.fold(new Segment.Index(i), axis, () -> ctx.printField(axis, "value"));
        }
        ctx.write("])");
    }

    static boolean isRemappable(IrNode.Sequence axes) {
        if (axes.size() < 2) return false;
        for (IrNode element : axes.elements()) {
            if (!(element instanceof IrNode.Composite axis) || !axis.kind().equals(TirKinds.AXIS_BINDING)) return false;
            String iterType = TirPrinting.stringField(axis, "iter_type").orElse("");
            if (!iterType.equals("spatial") && !iterType.equals("reduce")) return false;
            if (!axis.hasField("var") || !PrintContext.isKind(axis.field("value").orElse(null), TirKinds.VAR)) return false;
        }
        return true;
    }
}

package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.ir.IrNodes;
import org.irlens.ir.tir.TirKinds;
import org.irlens.path.Segment;
import org.irlens.render.DisplayWidth;
import org.irlens.render.INodePrinter;
import org.irlens.render.PrintContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints a function as a decorated {@code def} with typed parameters, one
 * {@code T.match_buffer} line per buffer binding, and the body. The parameter list wraps to
 * one parameter per line when the signature would exceed the configured line width.
 */
public final class PrimFuncPrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        ctx.write("@T.prim_func");
        ctx.startLine();
        ctx.write("def ");
        node.field("name").ifPresent(name -> ctx.printName(ctx.segment(node, "name"), name));
        node.field("params").ifPresent(params -> {
            if (params instanceof IrNode.Sequence seq) {
                printParams(node, seq, ctx);
            } else {
                ctx.write("(");
                ctx.print(ctx.segment(node, "params"), params);
                ctx.write(")");
            }
        });
        if (!node.hasField("params")) ctx.write("()");
        ctx.write(":");
        ctx.indent();
        if (ctx.config().showMetadata() && node.hasField("attrs")) {
            ctx.startLine();
            ctx.write("T.func_attr(");
            ctx.printField(node, "attrs");
            ctx.write(")");
        }
        node.field("buffer_map").ifPresent(map -> printBufferMap(node, map, ctx));
        TirPrinting.onNewLine(ctx, node, "body");
        ctx.dedent();
    }

    private void printParams(IrNode.Composite owner, IrNode.Sequence params, PrintContext ctx) {
        List<String> declarations = new ArrayList<>();
        for (IrNode param : params.elements()) declarations.add(declaration(param));
        int width = ctx.column() + "():".length();
        for (String declaration : declarations) width += DisplayWidth.of(declaration);
        width += Math.max(0, declarations.size() - 1) * ", ".length();
        boolean wrap = !declarations.isEmpty() && width > ctx.config().lineWidth();

        ctx.printAs(ctx.segment(owner, "params"), params, () -> {
            ctx.write("(");
            if (wrap) ctx.indent();
            for (int i = 0; i < params.size(); i++) {
                if (wrap) {
                    ctx.startLine();
                } else if (i > 0) {
                    ctx.write(", ");
                }
                TirPrinting.declaration(ctx, new Segment.Index(i), params.get(i));
                if (wrap) ctx.write(",");
            }
            if (wrap) {
                ctx.dedent();
                ctx.startLine();
            }
            ctx.write(")");
        });
    }

    private static String declaration(IrNode param) {
        if (param instanceof IrNode.Composite var && var.kind().equals(TirKinds.VAR)) {
            String name = TirPrinting.stringField(var, "name").orElse("_");
            return TirPrinting.stringField(var, "dtype").map(dtype -> name + ": T." + dtype).orElse(name);
        }
        return IrNodes.describe(param);
    }

    private void printBufferMap(IrNode.Composite owner, IrNode map, PrintContext ctx) {
        if (!(map instanceof IrNode.Mapping mapping)) {
            ctx.startLine();
            ctx.print(ctx.segment(owner, "buffer_map"), map);
            return;
        }
        if (mapping.size() > 0) ctx.startLine();
        ctx.printAs(ctx.segment(owner, "buffer_map"), mapping, () -> {
            for (IrNode.Mapping.Entry entry : mapping.entries()) {
                ctx.startLine();
                printBinding(entry, ctx);
            }
        });
    }

    private void printBinding(IrNode.Mapping.Entry entry, PrintContext ctx) {
        Segment segment = new Segment.Key(entry.key());
        IrNode value = entry.value();
        if (value instanceof IrNode.Composite buffer && buffer.kind().equals(TirKinds.BUFFER)) {
            ctx.printAs(segment, buffer, () -> {
                buffer.field("name").ifPresent(name -> ctx.printName(ctx.segment(buffer, "name"), name));
                ctx.write(" = T.match_buffer(");
                ctx.printDetached(entry.key());
                if (buffer.hasField("shape")) {
                    ctx.write(", ");
                    TirPrinting.tuple(ctx, buffer, "shape");
                }
                if (buffer.hasField("dtype")) {
                    ctx.write(", ");
                    ctx.printField(buffer, "dtype");
                }
                ctx.write(")");
            });
        } else {
            ctx.printDetached(entry.key());
            ctx.write(" = ");
            ctx.print(segment, value);
        }
    }
}

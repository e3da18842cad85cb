package org.irlens.render.tir;

import org.irlens.ir.IrNode;
import org.irlens.ir.tir.TirKinds;
import org.irlens.path.Segment;
import org.irlens.render.PrintContext;

import java.util.Optional;

/**
 * Small formatting helpers shared by the TIR printers.
 */
final class TirPrinting {

    private TirPrinting() {}

    /**
     * Prints a sequence field as a Python tuple, {@code (a, b)} or {@code (a,)}.
     */
    static void tuple(PrintContext ctx, IrNode.Composite owner, String field) {
        owner.field(field).ifPresent(value -> {
            if (value instanceof IrNode.Sequence seq) {
                ctx.printAs(ctx.segment(owner, field), seq, () -> {
                    ctx.write("(");
                    ctx.printElements(seq, ", ");
                    if (seq.size() == 1) ctx.write(",");
                    ctx.write(")");
                });
            } else {
                ctx.print(ctx.segment(owner, field), value);
            }
        });
    }

    /**
     * Prints a sequence field as subscript indices, {@code [i, j]}.
     */
    static void subscript(PrintContext ctx, IrNode.Composite owner, String field) {
        owner.field(field).ifPresent(value -> {
            if (value instanceof IrNode.Sequence seq) {
                ctx.printAs(ctx.segment(owner, field), seq, () -> {
                    ctx.write("[");
                    ctx.printElements(seq, ", ");
                    ctx.write("]");
                });
            } else {
                ctx.write("[");
                ctx.print(ctx.segment(owner, field), value);
                ctx.write("]");
            }
        });
    }

    /**
     * Prints a variable where it is bound, {@code x: T.int32}. The variable's span covers the
     * whole declaration and its name and dtype get spans of their own. Anything other than a
     * {@code var} is printed as usual.
     */
    static void declaration(PrintContext ctx, Segment segment, IrNode node) {
        if (node instanceof IrNode.Composite var && var.kind().equals(TirKinds.VAR)) {
            ctx.printAs(segment, var, () -> {
                var.field("name").ifPresent(name -> ctx.printName(ctx.segment(var, "name"), name));
                if (var.hasField("dtype")) {
                    ctx.write(": ");
                    qualified(ctx, var, "dtype", "T.");
                }
            });
        } else {
            ctx.print(segment, node);
        }
    }

    /**
     * Prints a string field as a {@code T.<value>} token, e.g. a dtype or a loop kind.
     */
    static void qualified(PrintContext ctx, IrNode.Composite owner, String field, String prefix) {
        owner.field(field).ifPresent(value -> {
            Optional<String> text = PrintContext.stringValue(value);
            if (text.isPresent()) {
                ctx.printAs(ctx.segment(owner, field), value, () -> ctx.write(prefix + text.get()));
            } else {
                ctx.print(ctx.segment(owner, field), value);
            }
        });
    }

    static Optional<String> stringField(IrNode.Composite owner, String field) {
        return owner.field(field).flatMap(PrintContext::stringValue);
    }

    /**
     * Prints a field that must start on its own line, e.g. a body that may be a bare expression.
     */
    static void onNewLine(PrintContext ctx, IrNode.Composite owner, String field) {
        if (owner.hasField(field)) {
            ctx.startLine();
            ctx.printField(owner, field);
        }
    }
}

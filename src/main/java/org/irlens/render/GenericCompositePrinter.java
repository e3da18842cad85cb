package org.irlens.render;

import org.irlens.ir.IrNode;
import org.irlens.ir.schema.FieldDescriptor;
import org.irlens.ir.schema.FieldRole;
import org.irlens.ir.schema.NodeKindSchema;

/**
 * Fallback printer for kinds without a dedicated printer. Prints
 * {@code kind(field=value, ...)} in schema order. Once a field holding statements is
 * reached, the header ends with a colon and that field and every later one are printed as
 * an indented block, so schema order is kept in the text.
 * Metadata fields are printed only when the config asks for them.
 */
final class GenericCompositePrinter implements INodePrinter {

    @Override
    public void print(IrNode.Composite node, PrintContext ctx) {
        NodeKindSchema schema = ctx.schemas().validate(node, ctx.currentPath().toString());
        ctx.write(node.kind() + "(");
        boolean block = false;
        boolean first = true;
        for (FieldDescriptor field : schema.fields()) {
            IrNode child = node.fields().get(field.name());
            if (child == null) continue;
            if (field.role() == FieldRole.METADATA && !ctx.config().showMetadata()) continue;
            if (!block && holdsStatements(child, ctx)) {
                ctx.write("):");
                ctx.indent();
                block = true;
            }
            if (block) {
                if (holdsStatements(child, ctx)) {
                    ctx.print(field.segment(), child);
                } else {
                    ctx.startLine();
                    ctx.write(field.name() + " = ");
                    ctx.print(field.segment(), child);
                }
            } else {
                if (!first) ctx.write(", ");
                ctx.write(field.name() + "=");
                ctx.print(field.segment(), child);
                first = false;
            }
        }
        if (block) {
            ctx.dedent();
        } else {
            ctx.write(")");
        }
    }

    private static boolean holdsStatements(IrNode child, PrintContext ctx) {
        if (child instanceof IrNode.Sequence sequence) return ctx.isStatementBlock(sequence);
        return ctx.schemas().isStatement(child);
    }
}

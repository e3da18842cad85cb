package org.irlens.render;

import org.irlens.ir.IrNode;
import org.irlens.ir.IrValue;
import org.irlens.ir.schema.FieldDescriptor;
import org.irlens.ir.schema.SchemaRegistry;
import org.irlens.path.NodePath;
import org.irlens.path.Segment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable context passed to node printers during a render.
 * Tracks the current node path, writes text, and records one span per printed node.
 */
public final class PrintContext {

    private final SchemaRegistry schemas;
    private final NodePrinterRegistry printers;
    private final RenderConfig config;
    private final TextBuffer out;
    private final List<PrintedSpan> spans = new ArrayList<>();
    private final Map<String, Integer> ordinals = new HashMap<>();
    private NodePath current = NodePath.root();
    private int detached;

    PrintContext(SchemaRegistry schemas, NodePrinterRegistry printers, RenderConfig config) {
        this.schemas = schemas;
        this.printers = printers;
        this.config = config;
        this.out = new TextBuffer(config.indentSpaces());
    }

    public RenderConfig config() {
        return config;
    }

    public SchemaRegistry schemas() {
        return schemas;
    }

    /**
     * @return The path of the node currently being printed.
     */
    public NodePath currentPath() {
        return current;
    }

    public void write(String text) {
        out.write(text);
    }

    public void startLine() {
        out.startLine();
    }

    public void indent() {
        out.indent();
    }

    public void dedent() {
        out.dedent();
    }

    /**
     * @return Display columns already used on the current line, indentation included.
     */
    public int column() {
        return out.next().column() - 1;
    }

    /**
     * Prints a child with its default form and records its span.
     *
     * @param segment The step from the current node to the child.
     * @param child The child node.
     */
    public void print(Segment segment, IrNode child) {
        descend(segment, child, true, () -> dispatch(child));
    }

    /**
     * Prints a field of a composite if it is present.
     *
     * @param owner The composite being printed.
     * @param fieldName The field to print.
     * @return Whether the field was present.
     */
    public boolean printField(IrNode.Composite owner, String fieldName) {
        Optional<IrNode> child = owner.field(fieldName);
        child.ifPresent(node -> print(segment(owner, fieldName), node));
        return child.isPresent();
    }

    /**
     * Prints a child with custom text and records its span around whatever {@code body}
     * writes.
     */
    public void printAs(Segment segment, IrNode child, Runnable body) {
        descend(segment, child, true, body);
    }

    /**
     * Enters a child without recording a span for it. Used for nodes that a sugared form
     * folds away; descendants printed inside {@code body} still get spans at their full paths.
     */
    public void fold(Segment segment, IrNode child, Runnable body) {
        descend(segment, child, false, body);
    }

    /**
     * Prints a string leaf without quotes, e.g. an identifier, and records its span.
     * Non-string nodes are printed normally.
     */
    public void printName(Segment segment, IrNode node) {
        Optional<String> name = stringValue(node);
        if (name.isPresent()) {
            printAs(segment, node, () -> write(name.get()));
        } else {
            print(segment, node);
        }
    }

    /**
     * Prints a node that has no address of its own, such as a mapping key. Nothing printed
     * inside gets a span.
     */
    public void printDetached(IrNode node) {
        detached++;
        try {
            descend(null, node, false, () -> dispatch(node));
        } finally {
            detached--;
        }
    }

    /**
     * Prints each element of a sequence under its index segment.
     */
    public void printElements(IrNode.Sequence sequence, String separator) {
        for (int i = 0; i < sequence.size(); i++) {
            if (i > 0) write(separator);
            print(new Segment.Index(i), sequence.get(i));
        }
    }

    /**
     * @return The path segment for a field of a composite, as its schema declares it.
     */
    public Segment segment(IrNode.Composite owner, String fieldName) {
        return schemas.lookup(owner.kind())
                .flatMap(schema -> schema.field(fieldName))
                .map(FieldDescriptor::segment)
                .orElseGet(() -> new Segment.Field(fieldName));
    }

    public static Optional<String> stringValue(IrNode node) {
        if (node instanceof IrNode.Leaf leaf && leaf.value() instanceof IrValue.Str str) {
            return Optional.of(str.value());
        }
        return Optional.empty();
    }

    public static Optional<Long> longValue(IrNode node) {
        if (node instanceof IrNode.Leaf leaf && leaf.value() instanceof IrValue.Int64 value) {
            return Optional.of(value.value());
        }
        return Optional.empty();
    }

    public static boolean isKind(IrNode node, String kind) {
        return node instanceof IrNode.Composite composite && composite.kind().equals(kind);
    }

    void printRoot(IrNode root) {
        descend(null, root, true, () -> dispatch(root));
    }

    List<PrintedSpan> spans() {
        return spans;
    }

    List<String> lines() {
        return out.lines();
    }

    private void descend(Segment segment, IrNode node, boolean record, Runnable body) {
        NodePath saved = current;
        if (segment != null) current = current.append(segment);
        try {
            if (node instanceof IrNode.Composite composite) {
                schemas.validate(composite, current.toString());
            }
            if (record && startsLine(node)) out.startLine();
            TextBuffer.Position start = out.next();
            TextBuffer.Position before = out.lastWritten();
            boolean recording = record && detached == 0;
            int ordinal = 0;
            if (recording && node instanceof IrNode.Composite composite) {
                ordinal = ordinals.merge(composite.kind(), 1, Integer::sum);
            }
            body.run();
            if (recording) {
                TextBuffer.Position after = out.lastWritten();
                TextBuffer.Position end = after == before ? start : after;
                spans.add(new PrintedSpan(current, node, start, end, ordinal));
            }
        } finally {
            current = saved;
        }
    }

    private void dispatch(IrNode node) {
        if (node instanceof IrNode.Leaf leaf) {
            write(leaf.value().literal());
        } else if (node instanceof IrNode.Composite composite) {
            printers.resolve(composite.kind()).print(composite, this);
        } else if (node instanceof IrNode.Sequence sequence) {
            if (isStatementBlock(sequence)) {
                for (int i = 0; i < sequence.size(); i++) {
                    print(new Segment.Index(i), sequence.get(i));
                }
            } else {
                write("[");
                printElements(sequence, ", ");
                write("]");
            }
        } else if (node instanceof IrNode.Mapping mapping) {
            write("{");
            boolean first = true;
            for (IrNode.Mapping.Entry entry : mapping.entries()) {
                if (!first) write(", ");
                first = false;
                printDetached(entry.key());
                write(": ");
                print(new Segment.Key(entry.key()), entry.value());
            }
            write("}");
        }
    }

    private boolean startsLine(IrNode node) {
        if (node instanceof IrNode.Sequence sequence) return isStatementBlock(sequence);
        return schemas.isStatement(node);
    }

    /**
     * @return Whether a sequence is a non-empty list of statements, printed one per line.
     */
    public boolean isStatementBlock(IrNode.Sequence sequence) {
        if (sequence.size() == 0) return false;
        for (IrNode element : sequence.elements()) {
            if (!schemas.isStatement(element)) return false;
        }
        return true;
    }
}

package org.irlens.render;

import org.irlens.api.AnnotationOnExpressionException;
import org.irlens.api.PathNotFoundException;
import org.irlens.api.UnderlineTargetNotFoundException;
import org.irlens.ir.IrNode;
import org.irlens.ir.schema.SchemaRegistry;
import org.irlens.path.NodePath;
import org.irlens.path.PathResolver;
import org.irlens.path.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders an IR tree to TVMScript-like text, recording the span of every printed node and
 * marking requested nodes with caret underlines and comment annotations.
 * <p>
 * Rendering is deterministic: the same tree, config and requests always produce the same
 * text and spans. Requests are validated before anything is printed, so a bad request
 * fails the whole call and produces no partial output.
 * <p>
 * Instances hold no per-call state and may be shared between threads once their
 * registries are populated.
 */
public class AnnotatedRenderer {

    private static final Logger log = LoggerFactory.getLogger(AnnotatedRenderer.class);

    private final SchemaRegistry schemas;
    private final NodePrinterRegistry printers;
    private final TreeWalker walker;

    /**
     * @param schemas The schema table fixing field order and statement kinds.
     * @param printers The printers to use per kind.
     */
    public AnnotatedRenderer(SchemaRegistry schemas, NodePrinterRegistry printers) {
        this.schemas = schemas;
        this.printers = printers;
        this.walker = new TreeWalker(schemas);
    }

    /**
     * @return A renderer for the built-in TIR kinds.
     */
    public static AnnotatedRenderer withDefaults() {
        return new AnnotatedRenderer(SchemaRegistry.initializeWithDefaults(), NodePrinterRegistry.initializeWithDefaults());
    }

    /**
     * Renders a tree without marks.
     *
     * @param root The tree.
     * @param config Rendering options.
     * @return The text and its span table.
     */
    public RenderResult render(IrNode root, RenderConfig config) {
        return print(root, config, List.of());
    }

    /**
     * Renders a tree, underlining and annotating the requested nodes.
     *
     * @param root The tree.
     * @param config Rendering options.
     * @param underline Nodes to underline. An identity target marks every occurrence.
     * @param annotate Statements to annotate.
     * @return The marked-up text, its span table and one outcome per request.
     * @throws PathNotFoundException if a path target does not resolve.
     * @throws UnderlineTargetNotFoundException if an identity target occurs nowhere in the tree.
     * @throws AnnotationOnExpressionException if an annotation targets a non-statement.
     */
    public RenderResult render(IrNode root, RenderConfig config, List<RenderTarget> underline, List<AnnotationRequest> annotate)
            throws PathNotFoundException, UnderlineTargetNotFoundException, AnnotationOnExpressionException {
        List<Request> requests = new ArrayList<>();
        for (RenderTarget target : underline) {
            requests.add(new Request(RequestOutcome.Type.UNDERLINE, target, null, resolve(root, target)));
        }
        for (AnnotationRequest annotation : annotate) {
            List<Occurrence> occurrences = resolve(root, annotation.target());
            for (Occurrence occurrence : occurrences) {
                if (!schemas.isStatement(occurrence.node())) {
                    throw new AnnotationOnExpressionException(annotation.target().toString(), kindOf(occurrence.node()));
                }
            }
            requests.add(new Request(RequestOutcome.Type.ANNOTATION, annotation.target(), annotation.label(), occurrences));
        }
        return print(root, config, requests);
    }

    private RenderResult print(IrNode root, RenderConfig config, List<Request> requests) {
        PrintContext ctx = new PrintContext(schemas, printers, config);
        ctx.printRoot(root);
        List<PrintedSpan> printed = ctx.spans();
        Map<NodePath, List<PrintedSpan>> byPath = new HashMap<>();
        for (PrintedSpan span : printed) {
            byPath.computeIfAbsent(span.path().withFieldsOnly(), p -> new ArrayList<>()).add(span);
        }

        TextOverlay overlay = new TextOverlay(ctx.lines());
        List<Marked> marked = new ArrayList<>();
        for (Request request : requests) {
            Marked mark = mark(request, byPath);
            for (int i = 0; i < mark.spans().size(); i++) {
                PrintedSpan span = mark.spans().get(i);
                if (request.type() == RequestOutcome.Type.UNDERLINE) {
                    overlay.underline(span);
                } else {
                    overlay.annotate(span, mark.label());
                }
            }
            marked.add(mark);
        }

        TextOverlay.Layout layout = overlay.apply();
        List<SpanTable.Entry> entries = new ArrayList<>(printed.size());
        for (PrintedSpan span : printed) {
            entries.add(new SpanTable.Entry(span.path(), span.node(), layout.toSpan(span), span.ordinal()));
        }
        List<RequestOutcome> outcomes = new ArrayList<>(marked.size());
        for (Marked mark : marked) {
            List<Span> spans = new ArrayList<>();
            List<NodePath> renderedPaths = new ArrayList<>();
            for (PrintedSpan span : mark.spans()) {
                spans.add(layout.toSpan(span));
                renderedPaths.add(span.path());
            }
            Request request = mark.request();
            List<NodePath> paths = new ArrayList<>();
            for (Occurrence occurrence : request.occurrences()) paths.add(occurrence.path());
            outcomes.add(new RequestOutcome(request.type(), request.target(), mark.label(), paths, renderedPaths, spans, mark.fallback()));
        }
        log.debug("Rendered {} lines, {} spans, {} requests", ctx.lines().size(), entries.size(), requests.size());
        return new RenderResult(layout.text(), new SpanTable(entries), outcomes);
    }

    private Marked mark(Request request, Map<NodePath, List<PrintedSpan>> byPath) {
        List<PrintedSpan> spans = new ArrayList<>();
        boolean fallback = false;
        String label = request.label();
        for (Occurrence occurrence : request.occurrences()) {
            NodePath path = occurrence.path();
            PrintedSpan span = pick(byPath, path, occurrence.node());
            while (span == null && !path.isRoot()) {
                path = path.parent();
                span = pick(byPath, path, null);
            }
            if (span == null) {
                throw new IllegalStateException("Root of the rendered tree has no span");
            }
            if (span.node() != occurrence.node()) {
                fallback = true;
                log.debug("{} at {} is folded; marking enclosing {} instead", kindOf(occurrence.node()), occurrence.path(), span.path());
            }
            if (label == null && request.type() == RequestOutcome.Type.ANNOTATION) {
                label = defaultLabel(occurrence.node(), span);
            }
            spans.add(span);
        }
        return new Marked(request, spans, label, fallback);
    }

    /**
     * Picks the span printed at {@code path}. Structurally equal mapping keys give several
     * candidates; the one reached through the same key nodes wins, then one showing
     * {@code node}, then the first printed.
     */
    private static PrintedSpan pick(Map<NodePath, List<PrintedSpan>> byPath, NodePath path, IrNode node) {
        List<PrintedSpan> candidates = byPath.get(path.withFieldsOnly());
        if (candidates == null) return null;
        for (PrintedSpan candidate : candidates) {
            if (candidate.path().sameOccurrence(path)) return candidate;
        }
        for (PrintedSpan candidate : candidates) {
            if (candidate.node() == node) return candidate;
        }
        return candidates.get(0);
    }

    private static String defaultLabel(IrNode requested, PrintedSpan span) {
        if (span.ordinal() > 0 && span.node() instanceof IrNode.Composite composite) {
            return composite.kind() + " #" + span.ordinal();
        }
        return kindOf(requested);
    }

    private List<Occurrence> resolve(IrNode root, RenderTarget target)
            throws PathNotFoundException, UnderlineTargetNotFoundException {
        List<Occurrence> occurrences = new ArrayList<>();
        if (target instanceof RenderTarget.ByPath byPath) {
            occurrences.add(new Occurrence(byPath.path(), PathResolver.resolve(root, byPath.path())));
        } else if (target instanceof RenderTarget.ByIdentity byIdentity) {
            IrNode node = byIdentity.node();
            for (NodePath path : walker.occurrences(root, node)) {
                occurrences.add(new Occurrence(path, node));
            }
            if (occurrences.isEmpty()) {
                throw new UnderlineTargetNotFoundException(node.handle());
            }
        }
        return occurrences;
    }

    static String kindOf(IrNode node) {
        if (node instanceof IrNode.Composite composite) return composite.kind();
        if (node instanceof IrNode.Sequence) return "sequence";
        if (node instanceof IrNode.Mapping) return "mapping";
        return "leaf";
    }

    private record Occurrence(NodePath path, IrNode node) {}

    private record Request(RequestOutcome.Type type, RenderTarget target, String label, List<Occurrence> occurrences) {}

    private record Marked(Request request, List<PrintedSpan> spans, String label, boolean fallback) {}
}

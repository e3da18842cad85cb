package org.irlens.render;

import org.irlens.ir.IrNode;

import java.util.List;

/**
 * The output of a render.
 *
 * @param text The rendered text, including annotation and underline lines.
 * @param spans Spans of every printed node, relative to {@code text}.
 * @param outcomes One outcome per request: underlines first, then annotations, each in
 *                 request order.
 */
public record RenderResult(String text, SpanTable spans, List<RequestOutcome> outcomes) {

    public RenderResult {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * @return The text split into lines.
     */
    public List<String> lines() {
        String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        return List.of(body.split("\n", -1));
    }

    public List<Span> spansOf(IrNode node) {
        return spans.spansOf(node);
    }

    /**
     * @return Whether any request had to mark an ancestor of a folded node.
     */
    public boolean anyFallback() {
        return outcomes.stream().anyMatch(RequestOutcome::fallback);
    }
}

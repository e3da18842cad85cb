package org.irlens.render;

import org.irlens.ir.IrNode;
import org.irlens.ir.NodeHandle;
import org.irlens.path.NodePath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every span recorded by one render, indexed by path and by node identity. Spans are in
 * final-text coordinates. Nodes folded by syntax sugar have no entry.
 * <p>
 * Path lookups ignore the difference between field and attribute segments, since both
 * address the same child. Where two mapping keys are structurally equal, the entry reached
 * through the very key node named in the path wins.
 */
public final class SpanTable {

    /**
     * One printed occurrence of a node.
     *
     * @param path The path at which the node was printed.
     * @param node The node object.
     * @param span Its region of the rendered text.
     * @param ordinal 1-based visitation number among printed nodes of the same kind, or 0
     *                for leaves, sequences and mappings.
     */
    public record Entry(NodePath path, IrNode node, Span span, int ordinal) {}

    private final List<Entry> entries;
    private final Map<NodePath, List<Entry>> byPath = new HashMap<>();
    private final Map<NodeHandle, List<Span>> byHandle = new LinkedHashMap<>();

    SpanTable(List<Entry> recorded) {
        List<Entry> sorted = new ArrayList<>(recorded);
        sorted.sort(Comparator.comparingInt((Entry e) -> e.span().startOffset())
                .thenComparing(Comparator.comparingInt((Entry e) -> e.span().endOffset()).reversed()));
        this.entries = Collections.unmodifiableList(sorted);
        for (Entry entry : sorted) {
            byPath.computeIfAbsent(entry.path().withFieldsOnly(), p -> new ArrayList<>()).add(entry);
            byHandle.computeIfAbsent(entry.node().handle(), h -> new ArrayList<>()).add(entry.span());
        }
    }

    /**
     * @return All entries, ordered by start offset, enclosing spans first.
     */
    public List<Entry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public Optional<Entry> entryAt(NodePath path) {
        List<Entry> candidates = byPath.getOrDefault(path.withFieldsOnly(), List.of());
        for (Entry candidate : candidates) {
            if (candidate.path().sameOccurrence(path)) return Optional.of(candidate);
        }
        return candidates.stream().findFirst();
    }

    public Optional<Span> spanAt(NodePath path) {
        return entryAt(path).map(Entry::span);
    }

    /**
     * @param node A node object.
     * @return The spans of all its printed occurrences, in text order; empty if it was
     *         never printed or always folded.
     */
    public List<Span> spansOf(IrNode node) {
        return spansOf(node.handle());
    }

    public List<Span> spansOf(NodeHandle handle) {
        return Collections.unmodifiableList(byHandle.getOrDefault(handle, List.of()));
    }

    /**
     * @return Node handle to spans, for every node printed at least once.
     */
    public Map<NodeHandle, List<Span>> byHandle() {
        return Collections.unmodifiableMap(byHandle);
    }
}

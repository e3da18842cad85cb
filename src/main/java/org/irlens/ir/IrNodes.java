package org.irlens.ir;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Schema-free helpers over IR nodes: structural equality and hashing (used to look up
 * mapping keys across tree instances) and short human-readable labels.
 */
public final class IrNodes {

    private static final Comparator<IrNode> CANONICAL_ORDER =
            Comparator.comparing(IrNodes::describe).thenComparing(IrNodes::canonicalForm);

    private IrNodes() {}

    /**
     * Compares two nodes by content. Composite fields are compared by name regardless of
     * stored order; mapping entries are compared as a multiset of pairs, each entry matched at most once. Bound variable names
     * are compared literally.
     *
     * @param a The first node.
     * @param b The second node.
     * @return {@code true} if both nodes have the same content.
     */
    public static boolean structurallyEqual(IrNode a, IrNode b) {
        return equal(a, b);
    }

    /**
     * Hash consistent with {@link #structurallyEqual(IrNode, IrNode)}.
     */
    public static int structuralHash(IrNode node) {
        return hash(node);
    }

    /**
     * Orders nodes independently of where they were allocated or inserted: by
     * {@link #describe(IrNode)} first, then by {@link #canonicalForm(IrNode)}. Structurally
     * equal nodes compare as equal; insertion order never matters.
     */
    public static Comparator<IrNode> canonicalOrder() {
        return CANONICAL_ORDER;
    }

    /**
     * Spells out a node's whole content with composite fields and mapping entries sorted,
     * e.g. {@code var(dtype=str:"int32", name=str:"i")}. Structurally equal nodes have the
     * same form.
     */
    public static String canonicalForm(IrNode node) {
        StringBuilder sb = new StringBuilder();
        appendForm(node, sb);
        return sb.toString();
    }

    /**
     * Returns a short label for a node, as used inside path keys: a leaf's literal, a
     * composite's {@code name} field when it holds a string, otherwise the kind.
     *
     * @param node The node to describe.
     * @return The label.
     */
    public static String describe(IrNode node) {
        if (node instanceof IrNode.Leaf leaf) {
            return leaf.value().literal();
        }
        if (node instanceof IrNode.Composite composite) {
            IrNode name = composite.fields().get("name");
            if (name instanceof IrNode.Leaf leaf && leaf.value() instanceof IrValue.Str str) {
                return str.value();
            }
            return composite.kind();
        }
        if (node instanceof IrNode.Sequence sequence) {
            return "sequence(" + sequence.size() + ")";
        }
        return "mapping(" + ((IrNode.Mapping) node).size() + ")";
    }

    private static boolean equal(IrNode a, IrNode b) {
        if (a == b) return true;
        if (a.getClass() != b.getClass()) return false;
        if (a instanceof IrNode.Leaf la) {
            return la.value().equals(((IrNode.Leaf) b).value());
        }
        if (a instanceof IrNode.Composite ca) {
            IrNode.Composite cb = (IrNode.Composite) b;
            if (!ca.kind().equals(cb.kind()) || !ca.fields().keySet().equals(cb.fields().keySet())) {
                return false;
            }
            for (Map.Entry<String, IrNode> field : ca.fields().entrySet()) {
                if (!equal(field.getValue(), cb.fields().get(field.getKey()))) return false;
            }
            return true;
        }
        if (a instanceof IrNode.Sequence sa) {
            IrNode.Sequence sb = (IrNode.Sequence) b;
            if (sa.size() != sb.size()) return false;
            for (int i = 0; i < sa.size(); i++) {
                if (!equal(sa.get(i), sb.get(i))) return false;
            }
            return true;
        }
        IrNode.Mapping ma = (IrNode.Mapping) a;
        IrNode.Mapping mb = (IrNode.Mapping) b;
        if (ma.size() != mb.size()) return false;
        List<IrNode.Mapping.Entry> remaining = new ArrayList<>(mb.entries());
        for (IrNode.Mapping.Entry entry : ma.entries()) {
            int match = -1;
            for (int i = 0; i < remaining.size(); i++) {
                IrNode.Mapping.Entry other = remaining.get(i);
                if (equal(entry.key(), other.key()) && equal(entry.value(), other.value())) {
                    match = i;
                    break;
                }
            }
            if (match < 0) return false;
            remaining.remove(match);
        }
        return true;
    }

    private static int hash(IrNode node) {
        if (node instanceof IrNode.Leaf leaf) {
            return leaf.value().hashCode();
        }
        if (node instanceof IrNode.Composite composite) {
            int h = composite.kind().hashCode();
            for (Map.Entry<String, IrNode> field : composite.fields().entrySet()) {
                h += field.getKey().hashCode() ^ hash(field.getValue());
            }
            return h;
        }
        if (node instanceof IrNode.Sequence sequence) {
            int h = 1;
            for (IrNode element : sequence.elements()) {
                h = 31 * h + hash(element);
            }
            return h;
        }
        int h = 7;
        for (IrNode.Mapping.Entry entry : ((IrNode.Mapping) node).entries()) {
            h += hash(entry.key()) ^ (31 * hash(entry.value()));
        }
        return h;
    }

    private static void appendForm(IrNode node, StringBuilder sb) {
        if (node instanceof IrNode.Leaf leaf) {
            sb.append(leaf.value().kindName()).append(':').append(leaf.value().literal());
        } else if (node instanceof IrNode.Composite composite) {
            sb.append(composite.kind()).append('(');
            String separator = "";
            for (Map.Entry<String, IrNode> field : new TreeMap<>(composite.fields()).entrySet()) {
                sb.append(separator).append(field.getKey()).append('=');
                appendForm(field.getValue(), sb);
                separator = ", ";
            }
            sb.append(')');
        } else if (node instanceof IrNode.Sequence sequence) {
            sb.append('[');
            String separator = "";
            for (IrNode element : sequence.elements()) {
                sb.append(separator);
                appendForm(element, sb);
                separator = ", ";
            }
            sb.append(']');
        } else {
            List<String> entries = new ArrayList<>();
            for (IrNode.Mapping.Entry entry : ((IrNode.Mapping) node).entries()) {
                entries.add(canonicalForm(entry.key()) + ": " + canonicalForm(entry.value()));
            }
            entries.sort(Comparator.naturalOrder());
            sb.append('{').append(String.join(", ", entries)).append('}');
        }
    }
}

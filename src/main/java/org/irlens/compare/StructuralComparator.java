package org.irlens.compare;

import org.irlens.api.MalformedTreeException;
import org.irlens.ir.IrNode;
import org.irlens.ir.IrNodes;
import org.irlens.ir.IrValue;
import org.irlens.ir.schema.FieldDescriptor;
import org.irlens.ir.schema.FieldRole;
import org.irlens.ir.schema.NodeKindSchema;
import org.irlens.ir.schema.SchemaRegistry;
import org.irlens.path.NodePath;
import org.irlens.path.Segment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds the first point at which two IR trees diverge.
 * <p>
 * Both trees are walked in lockstep, pre-order, with composite fields visited in the order
 * their kind's schema declares. The walk stops at the first difference (no attempt is made
 * to find a better alignment), so the reported pair of paths is the earliest divergence in
 * traversal order. Mapping entries are visited in {@link IrNodes#canonicalOrder()} of their
 * keys, so reordering a map never changes the report. Differences are ordinary results; only malformed input (an undeclared
 * field, an unknown kind) raises {@link MalformedTreeException}.
 * <p>
 * Instances hold no per-call state and may be shared between threads.
 */
public class StructuralComparator {

    private static final Logger log = LoggerFactory.getLogger(StructuralComparator.class);

    private final SchemaRegistry schemas;

    /**
     * @param schemas The schema table fixing canonical field order and binder positions.
     */
    public StructuralComparator(SchemaRegistry schemas) {
        this.schemas = schemas;
    }

    public SchemaRegistry schemas() {
        return schemas;
    }

    /**
     * Compares two trees.
     *
     * @param lhs The left tree.
     * @param rhs The right tree.
     * @param options Comparison options.
     * @return The first mismatch, or empty if the trees are structurally equal.
     */
    public Optional<MismatchRecord> compare(IrNode lhs, IrNode rhs, CompareOptions options) {
        MismatchRecord mismatch = new Walk(options).node(lhs, rhs, NodePath.root(), NodePath.root(), false);
        if (mismatch != null) {
            log.debug("Trees diverge: {}", mismatch);
        }
        return Optional.ofNullable(mismatch);
    }

    /**
     * Compares two trees exactly, optionally treating bound variables up to renaming.
     */
    public Optional<MismatchRecord> compare(IrNode lhs, IrNode rhs, boolean assumeAlphaEquivalentBindings) {
        return compare(lhs, rhs, CompareOptions.DEFAULT.withAlphaEquivalentBindings(assumeAlphaEquivalentBindings));
    }

    private record EntryPair(IrNode.Mapping.Entry lhs, IrNode.Mapping.Entry rhs) {}

    private static final Comparator<IrNode.Mapping.Entry> BY_KEY =
            Comparator.comparing(IrNode.Mapping.Entry::key, IrNodes.canonicalOrder());

    /**
     * The state of one comparison call: options and the binding bijection.
     */
    private final class Walk {
        private final CompareOptions options;
        private final BindingMap bindings = new BindingMap();

        Walk(CompareOptions options) {
            this.options = options;
        }

        MismatchRecord node(IrNode l, IrNode r, NodePath lp, NodePath rp, boolean binderPosition) {
            if (l.getClass() != r.getClass()) {
                return new MismatchRecord(lp, rp, MismatchReason.KIND_MISMATCH);
            }
            if (l instanceof IrNode.Leaf leaf) {
                return leaf(leaf, (IrNode.Leaf) r, lp, rp);
            }
            if (l instanceof IrNode.Composite composite) {
                return composite(composite, (IrNode.Composite) r, lp, rp, binderPosition);
            }
            if (l instanceof IrNode.Sequence sequence) {
                return sequence(sequence, (IrNode.Sequence) r, lp, rp, binderPosition);
            }
            return mapping((IrNode.Mapping) l, (IrNode.Mapping) r, lp, rp);
        }

        private MismatchRecord leaf(IrNode.Leaf l, IrNode.Leaf r, NodePath lp, NodePath rp) {
            IrValue a = l.value();
            IrValue b = r.value();
            if (a.getClass() != b.getClass()) {
                return new MismatchRecord(lp, rp, MismatchReason.KIND_MISMATCH);
            }
            boolean equal;
            if (a instanceof IrValue.Float64 fa) {
                double x = fa.value();
                double y = ((IrValue.Float64) b).value();
                equal = Double.compare(x, y) == 0 || Math.abs(x - y) <= options.floatTolerance();
            } else {
                equal = a.equals(b);
            }
            return equal ? null : new MismatchRecord(lp, rp, MismatchReason.VALUE_MISMATCH);
        }

        private MismatchRecord composite(IrNode.Composite l, IrNode.Composite r, NodePath lp, NodePath rp,
                                         boolean binderPosition) {
            NodeKindSchema schema = schemas.validate(l, lp.toString());
            if (!l.kind().equals(r.kind())) {
                schemas.validate(r, rp.toString());
                return new MismatchRecord(lp, rp, MismatchReason.KIND_MISMATCH);
            }
            schemas.validate(r, rp.toString());

            if (options.assumeAlphaEquivalentBindings() && schema.variable()) {
                return variable(l, r, lp, rp, schema, binderPosition);
            }
            if (schema.opensScope()) {
                bindings.enterScope();
            }
            try {
                return fields(l, r, lp, rp, schema, false);
            } finally {
                if (schema.opensScope()) {
                    bindings.leaveScope();
                }
            }
        }

        private MismatchRecord variable(IrNode.Composite l, IrNode.Composite r, NodePath lp, NodePath rp,
                                        NodeKindSchema schema, boolean binderPosition) {
            if (binderPosition) {
                MismatchRecord mismatch = fields(l, r, lp, rp, schema, true);
                if (mismatch == null) {
                    bindings.bind(l, r);
                }
                return mismatch;
            }
            return bindings.corresponds(l, r) ? null : new MismatchRecord(lp, rp, MismatchReason.VALUE_MISMATCH);
        }

        private MismatchRecord fields(IrNode.Composite l, IrNode.Composite r, NodePath lp, NodePath rp,
                                      NodeKindSchema schema, boolean skipNameHints) {
            for (FieldDescriptor field : schema.fields()) {
                if (skipNameHints && field.role() == FieldRole.NAME_HINT) {
                    continue;
                }
                IrNode lc = l.fields().get(field.name());
                IrNode rc = r.fields().get(field.name());
                if (lc == null && rc == null) {
                    continue;
                }
                Segment segment = field.segment();
                if (rc == null) {
                    return new MismatchRecord(lp.append(segment), rp, MismatchReason.MISSING_FIELD);
                }
                if (lc == null) {
                    return new MismatchRecord(lp, rp.append(segment), MismatchReason.EXTRA_FIELD);
                }
                MismatchRecord mismatch = node(lc, rc, lp.append(segment), rp.append(segment),
                        field.role() == FieldRole.BINDER);
                if (mismatch != null) {
                    return mismatch;
                }
            }
            return null;
        }

        private MismatchRecord sequence(IrNode.Sequence l, IrNode.Sequence r, NodePath lp, NodePath rp,
                                        boolean binderPosition) {
            int common = Math.min(l.size(), r.size());
            for (int i = 0; i < common; i++) {
                MismatchRecord mismatch = node(l.get(i), r.get(i), lp.index(i), rp.index(i), binderPosition);
                if (mismatch != null) {
                    return mismatch;
                }
            }
            // The common prefix is equal; only now does a length difference count.
            if (l.size() != r.size()) {
                return new MismatchRecord(lp, rp, MismatchReason.LENGTH_MISMATCH);
            }
            return null;
        }

        private MismatchRecord mapping(IrNode.Mapping l, IrNode.Mapping r, NodePath lp, NodePath rp) {
            List<IrNode.Mapping.Entry> unmatched = new ArrayList<>(r.entries());
            unmatched.sort(BY_KEY);
            List<IrNode.Mapping.Entry> ordered = new ArrayList<>(l.entries());
            ordered.sort(BY_KEY);
            List<EntryPair> pairs = new ArrayList<>();
            for (IrNode.Mapping.Entry le : ordered) {
                IrNode.Mapping.Entry re = takeCorresponding(le.key(), unmatched);
                if (re == null) {
                    return new MismatchRecord(lp.key(le.key()), rp, MismatchReason.MISSING_FIELD);
                }
                pairs.add(new EntryPair(le, re));
            }
            if (!unmatched.isEmpty()) {
                return new MismatchRecord(lp, rp.key(unmatched.get(0).key()), MismatchReason.EXTRA_FIELD);
            }
            for (EntryPair pair : pairs) {
                MismatchRecord mismatch = node(pair.lhs().value(), pair.rhs().value(),
                        lp.key(pair.lhs().key()), rp.key(pair.rhs().key()), false);
                if (mismatch != null) {
                    return mismatch;
                }
            }
            return null;
        }

        private IrNode.Mapping.Entry takeCorresponding(IrNode lhsKey, List<IrNode.Mapping.Entry> candidates) {
            for (int i = 0; i < candidates.size(); i++) {
                IrNode.Mapping.Entry candidate = candidates.get(i);
                if (node(lhsKey, candidate.key(), NodePath.root(), NodePath.root(), false) == null) {
                    return candidates.remove(i);
                }
            }
            return null;
        }
    }
}

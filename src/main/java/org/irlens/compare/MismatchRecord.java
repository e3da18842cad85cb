package org.irlens.compare;

import org.irlens.path.NodePath;

import java.util.Objects;

/**
 * The first divergence found by {@link StructuralComparator}. Holds only paths, never
 * nodes, so it can be handed to error-reporting layers without keeping trees alive.
 * <p>
 * For {@link MismatchReason#MISSING_FIELD} and {@link MismatchReason#EXTRA_FIELD} the side
 * that has the field is given the path to it and the other side the path of the enclosing
 * node, so both paths resolve in their own tree.
 *
 * @param lhsPath Position of the divergence in the left tree.
 * @param rhsPath Position of the divergence in the right tree.
 * @param reason Why the positions differ.
 */
public record MismatchRecord(NodePath lhsPath, NodePath rhsPath, MismatchReason reason) {

    public MismatchRecord {
        Objects.requireNonNull(lhsPath, "lhsPath");
        Objects.requireNonNull(rhsPath, "rhsPath");
        Objects.requireNonNull(reason, "reason");
    }

    @Override
    public String toString() {
        return reason + " at " + lhsPath + " vs " + rhsPath;
    }
}

package org.irlens.report;

import org.irlens.compare.MismatchRecord;
import org.irlens.render.RenderResult;

/**
 * A mismatch ready for a human: the record, a short description of the value found on each
 * side, and both trees rendered with their own mismatch path underlined.
 *
 * @param mismatch The comparator's record.
 * @param lhsValue Description of the node at the lhs path.
 * @param rhsValue Description of the node at the rhs path.
 * @param lhs The lhs tree, underlined at the lhs path.
 * @param rhs The rhs tree, underlined at the rhs path.
 */
public record MismatchReport(MismatchRecord mismatch, String lhsValue, String rhsValue, RenderResult lhs, RenderResult rhs) {

    /**
     * @return A multi-line report: reason, both paths with values, then both rendered trees.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Structural mismatch: ").append(mismatch.reason()).append('\n');
        sb.append("  lhs: ").append(mismatch.lhsPath()).append(" = ").append(lhsValue).append('\n');
        sb.append("  rhs: ").append(mismatch.rhsPath()).append(" = ").append(rhsValue).append('\n');
        sb.append("--- lhs\n").append(lhs.text());
        sb.append("--- rhs\n").append(rhs.text());
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}

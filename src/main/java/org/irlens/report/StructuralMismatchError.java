package org.irlens.report;

/**
 * Assertion failure raised when two trees were expected to be structurally equal.
 */
public class StructuralMismatchError extends AssertionError {

    private final transient MismatchReport report;

    public StructuralMismatchError(MismatchReport report) {
        super(report.format());
        this.report = report;
    }

    public MismatchReport report() {
        return report;
    }
}

package org.irlens.report;

import org.irlens.compare.CompareOptions;
import org.irlens.ir.IrNode;
import org.irlens.render.RenderConfig;

/**
 * Assertion helpers for tests of IR transformations.
 */
public final class IrAssertions {

    private static final MismatchReporter DEFAULT_REPORTER = MismatchReporter.withDefaults();

    private IrAssertions() {}

    /**
     * @throws StructuralMismatchError with a rendered report if the trees differ.
     */
    public static void assertStructuralEqual(IrNode actual, IrNode expected) {
        assertStructuralEqual(actual, expected, CompareOptions.DEFAULT);
    }

    public static void assertAlphaEquivalent(IrNode actual, IrNode expected) {
        assertStructuralEqual(actual, expected, CompareOptions.ALPHA_EQUIVALENT);
    }

    public static void assertStructuralEqual(IrNode actual, IrNode expected, CompareOptions options) {
        assertStructuralEqual(DEFAULT_REPORTER, actual, expected, options, RenderConfig.DEFAULT);
    }

    public static void assertStructuralEqual(MismatchReporter reporter, IrNode actual, IrNode expected,
                                             CompareOptions options, RenderConfig config) {
        reporter.report(actual, expected, options, config).ifPresent(report -> {
            throw new StructuralMismatchError(report);
        });
    }
}

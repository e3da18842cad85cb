package org.irlens.compare;

import com.typesafe.config.Config;

/**
 * Options for a single structural comparison.
 *
 * @param assumeAlphaEquivalentBindings Compare bound variables by binding position instead of name.
 * @param floatTolerance Maximum absolute difference under which two floats are equal; 0 means exact.
 */
public record CompareOptions(boolean assumeAlphaEquivalentBindings, double floatTolerance) {

    /** Exact comparison with names of bound variables taken literally. */
    public static final CompareOptions DEFAULT = new CompareOptions(false, 0.0);

    /** Exact comparison with bound variables compared up to renaming. */
    public static final CompareOptions ALPHA_EQUIVALENT = new CompareOptions(true, 0.0);

    public CompareOptions {
        if (floatTolerance < 0 || Double.isNaN(floatTolerance)) {
            throw new IllegalArgumentException("floatTolerance must be a non-negative number: " + floatTolerance);
        }
    }

    /**
     * Reads options from an {@code irlens.compare} style config subtree.
     *
     * @param config A config containing {@code assume-alpha-equivalent-bindings} and {@code float-tolerance}.
     * @return The options.
     */
    public static CompareOptions fromConfig(Config config) {
        return new CompareOptions(
                config.getBoolean("assume-alpha-equivalent-bindings"),
                config.getDouble("float-tolerance"));
    }

    public CompareOptions withAlphaEquivalentBindings(boolean enabled) {
        return new CompareOptions(enabled, floatTolerance);
    }

    public CompareOptions withFloatTolerance(double tolerance) {
        return new CompareOptions(assumeAlphaEquivalentBindings, tolerance);
    }
}

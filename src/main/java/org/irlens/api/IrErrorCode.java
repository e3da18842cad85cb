package org.irlens.api;

/**
 * Defines unique, testable error codes for every failure the comparator, resolver,
 * renderer and codec can raise. Tests assert on codes rather than on message text.
 */
public enum IrErrorCode {
    // region Caller contract violations
    /** A Node Path segment could not be applied to the tree it was resolved against. */
    PATH_NOT_FOUND,
    /** An identity-based underline or annotation target never occurs in the rendered tree. */
    UNDERLINE_TARGET_NOT_FOUND,
    /** An annotation was requested on an expression-level or leaf node. */
    ANNOTATION_ON_EXPRESSION,
    /** A render request was neither path-based nor identity-based, or was otherwise unusable. */
    INVALID_REQUEST,
    // endregion

    // region Malformed input
    /** A composite node carries a field its kind's schema does not declare. */
    UNDECLARED_FIELD,
    /** A composite node uses a kind that has no registered schema. */
    UNKNOWN_NODE_KIND,
    // endregion

    // region Serialization
    /** A JSON document does not describe a valid tree, path or mismatch record. */
    INVALID_JSON
    // endregion
}

package org.irlens.compare;

/**
 * Why two trees diverge at the reported position. These are ordinary comparison outcomes,
 * not errors.
 */
public enum MismatchReason {
    /** Node shapes differ (leaf vs composite, different kind tags, different scalar kinds). */
    KIND_MISMATCH,
    /** Scalars of the same kind hold different values, or variables do not correspond. */
    VALUE_MISMATCH,
    /** Sequences of different lengths whose common prefix is equal. */
    LENGTH_MISMATCH,
    /** The left side has a field or mapping key that the right side lacks. */
    MISSING_FIELD,
    /** The right side has a field or mapping key that the left side lacks. */
    EXTRA_FIELD
}

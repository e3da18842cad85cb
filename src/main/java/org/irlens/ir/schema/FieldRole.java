package org.irlens.ir.schema;

/**
 * How a declared field takes part in comparison and printing.
 */
public enum FieldRole {
    /** An ordinary child. */
    CHILD,
    /** Introduces bound variables into the enclosing scope (a loop variable, function parameters). */
    BINDER,
    /** A boxed scalar exposed as a logical attribute; addressed with an Attr path segment. */
    ATTRIBUTE,
    /** The surface name of a variable. Ignored when bound variables are compared up to renaming. */
    NAME_HINT,
    /** Auxiliary data such as function attributes; printed only when metadata display is on. */
    METADATA
}

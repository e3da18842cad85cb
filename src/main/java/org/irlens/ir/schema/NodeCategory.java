package org.irlens.ir.schema;

/**
 * Statement-vs-expression classification of a node kind. Only statement kinds accept
 * annotations.
 */
public enum NodeCategory {
    STATEMENT,
    EXPRESSION
}

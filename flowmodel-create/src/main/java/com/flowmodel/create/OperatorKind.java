package com.flowmodel.create;

/**
 * How an operator is defined.
 */
public enum OperatorKind {
    /** Body drawn in a net diagram. */
    GRAPHICAL,
    /** Body written in a text diagram. */
    TEXTUAL,
    /** Body provided outside the model. */
    IMPORTED
}

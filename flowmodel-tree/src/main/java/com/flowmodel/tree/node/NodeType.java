package com.flowmodel.tree.node;

/**
 * Shape of a tree node: a leaf wrapping one value, an operator with ordered operands, or a
 * composite of named fields (optionally preceded by positional operands).
 */
public enum NodeType {
    LEAF,
    OPERATOR,
    COMPOSITE
}

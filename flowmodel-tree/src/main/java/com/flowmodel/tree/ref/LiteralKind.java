package com.flowmodel.tree.ref;

/** Encoding of a literal value. */
public enum LiteralKind {
    BOOL,
    INT,
    REAL,
    CHAR
}

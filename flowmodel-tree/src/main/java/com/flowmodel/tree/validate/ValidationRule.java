package com.flowmodel.tree.validate;

/** Rules checked on trees, in the order the validator applies them to each node. */
public enum ValidationRule {
    /** Materialization context: anchor exists and accepts the root. */
    CONTEXT,
    /** A node may be materialized once. */
    NOT_CONSUMED,
    /** A node instance may have one parent. */
    SINGLE_OWNER,
    DOMAIN,
    ARITY,
    /** Local construction rules (sizes, paired lists, identifiers). */
    SHAPE,
    COMPOSITE_NOT_EMPTY,
    MANDATORY_FIELD,
    DUPLICATE_FIELD,
    UNKNOWN_FIELD,
    LITERAL_KIND,
    NAME_RESOLVES,
    ELEMENT_RESOLVES,
    ELEMENT_KIND
}

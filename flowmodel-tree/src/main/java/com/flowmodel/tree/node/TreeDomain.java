package com.flowmodel.tree.node;

/** What a tree describes once materialized. */
public enum TreeDomain {
    TYPE,
    EXPRESSION,
    TRANSITION,
    BRANCH
}

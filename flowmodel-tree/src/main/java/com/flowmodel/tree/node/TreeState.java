package com.flowmodel.tree.node;

/**
 * Lifecycle of a tree: {@code UNVALIDATED → VALIDATED → MATERIALIZING → MATERIALIZED | FAILED}.
 * MATERIALIZED and FAILED are terminal; a tree in either state is consumed and cannot be reused.
 */
public enum TreeState {
    UNVALIDATED,
    VALIDATED,
    MATERIALIZING,
    MATERIALIZED,
    FAILED;

    /** True once materialization started; such a tree may not be validated or materialized again. */
    public boolean isConsumed() {
        return this == MATERIALIZING || this == MATERIALIZED || this == FAILED;
    }
}

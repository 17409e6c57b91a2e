package com.flowmodel.tree.ref;

import com.flowmodel.tree.node.TreeNode;

import java.util.Objects;

/** Nested, not yet materialized sub-tree. */
public record TreeRef(TreeNode node) implements ExtendedRef {

    public TreeRef {
        Objects.requireNonNull(node, "node");
    }

    @Override
    public Kind kind() {
        return Kind.TREE;
    }

    @Override
    public String describe() {
        return node.describe();
    }
}

package com.flowmodel.tree.node;

import com.flowmodel.tree.build.ExpressionTrees;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TreeNodeTest {

    @Test
    void lifecycle_followsValidatedMaterializingMaterialized() {
        TreeNode node = ExpressionTrees.value(1);

        assertThrows(IllegalStateException.class, node::markMaterializing);
        node.markValidated();
        assertThrows(IllegalStateException.class, node::markValidated);
        node.markMaterializing();
        assertTrue(node.isConsumed());
        node.markMaterialized();

        assertEquals(TreeState.MATERIALIZED, node.getState());
        assertThrows(IllegalStateException.class, node::markValidated);
        assertThrows(IllegalStateException.class, node::markFailed);
    }

    @Test
    void failedTreeIsConsumed() {
        TreeNode node = ExpressionTrees.value(1);
        node.markValidated();
        node.markMaterializing();
        node.markFailed();

        assertTrue(node.isConsumed());
        assertThrows(IllegalStateException.class, node::markValidated);
    }

    @Test
    void construct_reportsArityBounds() {
        assertTrue(Construct.PLUS.acceptsArity(5));
        assertFalse(Construct.PLUS.acceptsArity(1));
        assertEquals("exactly 3", Construct.SLICE.describeArity());
        assertEquals("at least 2", Construct.CONCAT.describeArity());
    }

    @Test
    void composite_rejectsWrongNodeType() {
        assertThrows(IllegalArgumentException.class,
                () -> TreeNode.composite(Construct.PLUS, List.of(), List.of(), null));
    }
}

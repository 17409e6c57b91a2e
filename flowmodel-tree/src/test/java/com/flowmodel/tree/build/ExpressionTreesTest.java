package com.flowmodel.tree.build;

import com.flowmodel.tree.node.Construct;
import com.flowmodel.tree.node.HigherOrder;
import com.flowmodel.tree.node.TreeAttributes;
import com.flowmodel.tree.node.TreeNode;
import com.flowmodel.tree.node.TreeState;
import com.flowmodel.tree.ref.Literal;
import com.flowmodel.tree.ref.LiteralKind;
import com.flowmodel.tree.ref.LiteralRef;
import com.flowmodel.tree.ref.PredefinedNameRef;
import com.flowmodel.tree.ref.TreeRef;
import com.flowmodel.tree.validate.ValidationException;
import com.flowmodel.tree.validate.ValidationRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExpressionTreesTest {

    @Test
    void binary_enforcesExactArity() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> ExpressionTrees.apply(Construct.MINUS, List.of(1, 2, 3)));

        assertEquals(ValidationRule.ARITY, ex.getRule());
        assertEquals(2, ExpressionTrees.binary(Construct.MINUS, 3, 1).getOperands().size());
    }

    @Test
    void nary_needsTwoOperands() {
        assertThrows(ValidationException.class, () -> ExpressionTrees.nary(Construct.PLUS, 1));

        TreeNode sum = ExpressionTrees.nary(Construct.PLUS, 1, 2, ExpressionTrees.unary(Construct.NEG, 3));
        assertEquals(3, sum.getOperands().size());
        assertInstanceOf(TreeRef.class, sum.getOperands().get(2));
        assertEquals(TreeState.UNVALIDATED, sum.getState());
    }

    @Test
    void ifThenElse_requiresListsOfSameLength() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> ExpressionTrees.ifThenElse(true, List.of(1, 2), List.of(3)));

        assertEquals(ValidationRule.SHAPE, ex.getRule());
        TreeNode node = ExpressionTrees.ifThenElse("false", 1, 2);
        assertEquals(new LiteralRef(Literal.scalar(LiteralKind.BOOL, "false")), node.getField("condition"));
    }

    @Test
    void caseOf_parsesPatternsAndKeepsDefault() {
        TreeNode node = ExpressionTrees.caseOf(ExpressionTrees.value(1),
                List.of(Map.entry("Geo::RED", 10), Map.entry(2, 20)), 0);

        assertEquals(new PredefinedNameRef("Geo::RED"), node.getFieldValues("pattern").get(0));
        assertEquals(2, node.getFieldValues("value").size());
        assertEquals(1, node.getFieldValues("default").size());
        assertThrows(ValidationException.class, () -> ExpressionTrees.caseOf(1, List.of(), null));
    }

    @Test
    void dataStruct_rejectsEmptyFieldList() {
        ValidationException ex = assertThrows(ValidationException.class, () -> ExpressionTrees.dataStruct(List.of()));

        assertEquals(ValidationRule.COMPOSITE_NOT_EMPTY, ex.getRule());
    }

    @Test
    void prj_recordsPathOfLabelsAndIndices() {
        TreeNode node = ExpressionTrees.prj(ExpressionTrees.value(List.of(1, 2)), List.of("pos", 1));

        assertEquals(List.of("pos", "1"), node.getAttribute(TreeAttributes.PATH));
        assertThrows(ValidationException.class, () -> ExpressionTrees.prj(ExpressionTrees.value(1), List.of(-1)));
    }

    @Test
    void fby_resolvesDelayAsInteger() {
        TreeNode node = ExpressionTrees.fby(List.of(1), "2", List.of(0));

        LiteralRef delay = assertInstanceOf(LiteralRef.class, node.getField("delay"));
        assertEquals(LiteralKind.INT, delay.literal().kind());
    }

    @Test
    void call_checksModifierParameters() {
        TreeNode call = ExpressionTrees.call("Filter", List.of(), List.of(1), List.of(Modifier.map(4), Modifier.restart(true)));

        assertEquals(List.of(HigherOrder.MAP, HigherOrder.RESTART), ExpressionTrees.modifiersOf(call));
        assertEquals(2, call.getFieldValues("modifierParameter").size());
        ValidationException ex = assertThrows(ValidationException.class, () -> ExpressionTrees.call("Filter", List.of(),
                List.of(1), List.of(Modifier.of(HigherOrder.FOLDW, 4))));
        assertEquals(ValidationRule.ARITY, ex.getRule());
    }

    @Test
    void labelled_requiresIdentifier() {
        assertEquals("speed", ExpressionTrees.labelled(1, "speed").getLabel());
        assertThrows(ValidationException.class, () -> ExpressionTrees.labelled(1, "1x"));
    }
}

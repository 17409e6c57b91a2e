package com.flowmodel.tree.validate;

import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.GraphModelRegistry;
import com.flowmodel.graph.InMemoryGraphStore;
import com.flowmodel.graph.ModelBootstrap;
import com.flowmodel.graph.ModelRoles;
import com.flowmodel.session.SessionRegistry;
import com.flowmodel.session.UnknownNameException;
import com.flowmodel.tree.build.BranchTrees;
import com.flowmodel.tree.build.ExpressionTrees;
import com.flowmodel.tree.build.NamedValue;
import com.flowmodel.tree.build.TransitionTrees;
import com.flowmodel.tree.build.TypeTrees;
import com.flowmodel.tree.node.Construct;
import com.flowmodel.tree.node.Field;
import com.flowmodel.tree.node.TreeNode;
import com.flowmodel.tree.node.TreeState;
import com.flowmodel.tree.ref.ElementRef;
import com.flowmodel.tree.ref.Literal;
import com.flowmodel.tree.ref.LiteralKind;
import com.flowmodel.tree.ref.LiteralRef;
import com.flowmodel.tree.ref.Slot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuralValidatorTest {

    private InMemoryGraphStore store;
    private SessionRegistry session;
    private StructuralValidator validator;
    private ElementId model;
    private ElementId operator;
    private ElementId state;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        model = ModelBootstrap.newModel(store, "M");
        ElementId point = store.createElement(ElementKind.NAMED_TYPE, Map.of("name", "Point"), model, ModelRoles.TYPES);
        ElementId structure = store.createElement(ElementKind.STRUCTURE, Map.of(), point, ModelRoles.DEFINITION);
        store.createElement(ElementKind.COMPOSITE_ELEMENT, Map.of("name", "x"), structure, ModelRoles.ELEMENTS);
        store.createElement(ElementKind.COMPOSITE_ELEMENT, Map.of("name", "y"), structure, ModelRoles.ELEMENTS);
        store.link(point, ModelRoles.REF_TYPE, structure);
        operator = store.createElement(ElementKind.OPERATOR, Map.of("name", "Filter"), model, ModelRoles.OPERATORS);
        store.createElement(ElementKind.LOCAL_VARIABLE, Map.of("name", "i"), operator, ModelRoles.INPUTS);
        ElementId machine = store.createElement(ElementKind.STATE_MACHINE, Map.of("name", "SM"), operator, ModelRoles.FLOWS);
        state = store.createElement(ElementKind.STATE, Map.of("name", "Idle"), machine, ModelRoles.STATES);
        session = new SessionRegistry(new GraphModelRegistry(store));
        session.declare(model);
        validator = new StructuralValidator(store, session);
    }

    @Test
    void structValue_missingFieldIsNamedAndStoreUntouched() {
        TreeNode value = ExpressionTrees.structValue("Point", List.of(NamedValue.of("x", 1.0), NamedValue.of("x", 2.0)));
        int before = store.elementCount();

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(operator, TreeInput.of(value, Slot.FLOW)));

        assertEquals(ValidationRule.MANDATORY_FIELD, ex.getRule());
        assertTrue(ex.getMessage().contains("'y'"), ex.getMessage());
        assertEquals(before, store.elementCount());
        assertEquals(TreeState.UNVALIDATED, value.getState());
    }

    @Test
    void structValue_rejectsFieldOutsideStructure() {
        TreeNode value = ExpressionTrees.structValue("Point",
                List.of(NamedValue.of("x", 1.0), NamedValue.of("y", 2.0), NamedValue.of("z", 3.0)));

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(operator, TreeInput.of(value, Slot.FLOW)));

        assertEquals(ValidationRule.UNKNOWN_FIELD, ex.getRule());
    }

    @Test
    void closedComposite_reportsMissingBeforeDuplicate() {
        LiteralRef trigger = new LiteralRef(Literal.scalar(LiteralKind.BOOL, "true"));
        TreeNode transition = TreeNode.composite(Construct.TO_STATE, List.of(),
                List.of(new Field("trigger", trigger), new Field("trigger", trigger)), Map.of());

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(state, TreeInput.of(transition, Slot.TRANSITION)));

        assertEquals(ValidationRule.MANDATORY_FIELD, ex.getRule());
        assertTrue(ex.getMessage().contains("'target'"));
    }

    @Test
    void closedComposite_rejectsDuplicateField() {
        ElementRef target = new ElementRef(state);
        TreeNode transition = TreeNode.composite(Construct.TO_STATE, List.of(),
                List.of(new Field("target", target), new Field("target", target)), Map.of());

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(state, TreeInput.of(transition, Slot.TRANSITION)));

        assertEquals(ValidationRule.DUPLICATE_FIELD, ex.getRule());
    }

    @Test
    void branchReuse_isSingleOwnerViolation() {
        TreeNode shared = BranchTrees.ifAction();
        TreeNode tree = BranchTrees.ifTree(true, shared, shared);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(operator, TreeInput.of(tree, Slot.BRANCH)));

        assertEquals(ValidationRule.SINGLE_OWNER, ex.getRule());
        assertTrue(ex.getNode().startsWith("$.else"), ex.getNode());
    }

    @Test
    void branchReuse_acrossInputsIsRejected() {
        TreeNode branch = BranchTrees.whenBranch(1);

        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(operator,
                List.of(TreeInput.of(branch, Slot.BRANCH), TreeInput.of(branch, Slot.BRANCH))));

        assertEquals(ValidationRule.SINGLE_OWNER, ex.getRule());
        assertTrue(ex.getNode().startsWith("$[1]"));
    }

    @Test
    void consumedTree_cannotBeValidatedAgain() {
        TreeNode expr = ExpressionTrees.nary(Construct.PLUS, 1, 2);
        ValidatedTrees validated = validator.validate(operator, TreeInput.of(expr, Slot.FLOW));
        validated.markMaterializing();
        validated.markMaterialized();

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(operator, TreeInput.of(expr, Slot.FLOW)));

        assertEquals(ValidationRule.NOT_CONSUMED, ex.getRule());
    }

    @Test
    void sharedNode_cannotBeClaimedByTwoValidations() {
        TreeNode shared = ExpressionTrees.nary(Construct.PLUS, 1, 2);
        TreeNode first = ExpressionTrees.nary(Construct.MULT, shared, 3);
        TreeNode second = ExpressionTrees.nary(Construct.MULT, shared, 4);
        validator.validate(operator, TreeInput.of(first, Slot.FLOW));

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(operator, TreeInput.of(second, Slot.FLOW)));

        assertEquals(ValidationRule.SINGLE_OWNER, ex.getRule());
        assertEquals(TreeState.UNVALIDATED, second.getState());
        assertEquals(TreeState.VALIDATED, shared.getState());
    }

    @Test
    void unknownTypeName_failsWithCause() {
        TreeNode type = TypeTrees.alias("Nope");

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(model, TreeInput.of(type, Slot.TYPE)));

        assertEquals(ValidationRule.NAME_RESOLVES, ex.getRule());
        assertInstanceOf(UnknownNameException.class, ex.getCause());
    }

    @Test
    void success_marksNodesAndRecordsResolutions() {
        TreeNode type = TypeTrees.structure(NamedValue.of("a", "float32"), NamedValue.of("b", TypeTrees.table("Point", 3)));

        ValidatedTrees validated = validator.validate(model, TreeInput.of(type, Slot.TYPE));

        assertEquals(2, validated.getNodes().size());
        assertTrue(validated.getNodes().stream().allMatch(n -> n.getState() == TreeState.VALIDATED));
        assertEquals(session.lookupType("float32"), validated.resolved(Slot.TYPE, "float32"));
        assertEquals(session.lookupType("Point"), validated.resolved(Slot.TYPE, "Point"));
    }

    @Test
    void existingElement_mustFitSlot() {
        TreeNode expr = ExpressionTrees.nary(Construct.PLUS, 1, session.lookupType("Point"));

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(operator, TreeInput.of(expr, Slot.FLOW)));

        assertEquals(ValidationRule.ELEMENT_KIND, ex.getRule());
    }

    @Test
    void literalKind_isCheckedPerPosition() {
        TreeNode sized = TreeNode.operator(Construct.SIZED,
                List.of(new LiteralRef(Literal.scalar(LiteralKind.REAL, "1.5"))), Map.of());

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(model, TreeInput.of(sized, Slot.TYPE)));

        assertEquals(ValidationRule.LITERAL_KIND, ex.getRule());
    }

    @Test
    void call_argumentsMustMatchOperatorInputs() {
        TreeNode call = ExpressionTrees.call("Filter", List.of(1, 2));

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(operator, TreeInput.of(call, Slot.FLOW)));

        assertEquals(ValidationRule.ARITY, ex.getRule());
        validator.validate(operator, TreeInput.of(ExpressionTrees.call(operator, List.of(1)), Slot.FLOW));
    }

    @Test
    void transition_needsStateContext() {
        TreeNode transition = TransitionTrees.toState(true, state);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> validator.validate(operator, TreeInput.of(transition, Slot.TRANSITION)));

        assertEquals(ValidationRule.CONTEXT, ex.getRule());
        validator.validate(state, TreeInput.of(transition, Slot.TRANSITION));
        assertEquals(TreeState.VALIDATED, transition.getState());
    }
}

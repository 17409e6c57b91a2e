package com.flowmodel.create;

import com.flowmodel.config.FlowModelConfig;
import com.flowmodel.config.LayoutDefaults;
import com.flowmodel.graph.Box;
import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.GraphElement;
import com.flowmodel.graph.GraphModelRegistry;
import com.flowmodel.graph.InMemoryGraphStore;
import com.flowmodel.graph.ModelBootstrap;
import com.flowmodel.graph.ModelRoles;
import com.flowmodel.graph.Point;
import com.flowmodel.graph.PresentationEntry;
import com.flowmodel.graph.snapshot.GraphSnapshots;
import com.flowmodel.materializer.ownership.AmbiguousOwnerException;
import com.flowmodel.session.SessionRegistry;
import com.flowmodel.tree.build.BranchTrees;
import com.flowmodel.tree.build.ExpressionTrees;
import com.flowmodel.tree.build.NamedValue;
import com.flowmodel.tree.build.TransitionTrees;
import com.flowmodel.tree.build.TypeTrees;
import com.flowmodel.tree.node.Construct;
import com.flowmodel.tree.node.TreeNode;
import com.flowmodel.tree.node.TreeState;
import com.flowmodel.tree.validate.ValidationException;
import com.flowmodel.tree.validate.ValidationRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelEditorTest {

    private InMemoryGraphStore store;
    private SessionRegistry session;
    private ModelEditor editor;
    private ElementId model;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        model = ModelBootstrap.newModel(store, "M");
        session = new SessionRegistry(new GraphModelRegistry(store));
        session.declare(model);
        editor = new ModelEditor(store, session, FlowModelConfig.defaults(), LayoutDefaults.BUILT_IN);
    }

    private ElementId point() {
        return editor.createNamedType(model, "Point",
                TypeTrees.structure(NamedValue.of("x", "float32"), NamedValue.of("y", "float32")), "Types.xscade");
    }

    private ElementId graphicalOperator(String name) {
        return editor.createOperator(model, name, OperatorKind.GRAPHICAL, false, "Ops.xscade");
    }

    private ElementId diagramOf(ElementId dataDef) {
        return store.children(dataDef, ModelRoles.DIAGRAMS).get(0).getId();
    }

    @Test
    void createNamedType_structureWithOrderedFields() {
        ElementId point = point();

        GraphElement named = store.get(point);
        assertEquals("Point", named.getName());
        List<GraphElement> definitions = store.children(point, ModelRoles.DEFINITION);
        assertEquals(1, definitions.size());
        GraphElement structure = definitions.get(0);
        assertEquals(ElementKind.STRUCTURE, structure.getKind());
        assertEquals(structure.getId(), named.getReference(ModelRoles.REF_TYPE));
        List<GraphElement> fields = store.children(structure.getId(), ModelRoles.ELEMENTS);
        assertEquals(List.of("x", "y"), fields.stream().map(GraphElement::getName).toList());
        ElementId float32 = session.lookupType("float32");
        for (GraphElement field : fields) {
            assertEquals(float32, field.getReference(ModelRoles.REF_TYPE));
        }
        GraphElement unit = store.get(named.getReference(ModelRoles.REF_STORAGE_UNIT));
        assertEquals(ElementKind.STORAGE_UNIT, unit.getKind());
        assertEquals("Types.xscade", unit.getAttribute(ModelRoles.ATTR_PATH));
        assertEquals(point, session.lookupType("Point"));
    }

    @Test
    void createConstant_duplicateAndMissingFieldNamesMissingOne() {
        ElementId point = point();
        TreeNode value = ExpressionTrees.structValue(point, List.of(NamedValue.of("x", 0.0), NamedValue.of("x", 1.0)));
        int count = store.elementCount();

        ValidationException ex = assertThrows(ValidationException.class,
                () -> editor.createConstant(model, "Origin", point, value, null));

        assertEquals(ValidationRule.MANDATORY_FIELD, ex.getRule());
        assertTrue(ex.getMessage().contains("'y'"), ex.getMessage());
        assertEquals(count, store.elementCount());
    }

    @Test
    void createConstant_typedWithValue() {
        ElementId point = point();
        TreeNode value = ExpressionTrees.structValue(point, List.of(NamedValue.of("x", 0.0), NamedValue.of("y", 1.0)));

        ElementId origin = editor.createConstant(model, "Origin", point, value, null);

        GraphElement constant = store.get(origin);
        assertEquals(point, constant.getReference(ModelRoles.REF_TYPE));
        assertTrue(store.children(origin, ModelRoles.BUILD_TYPE).isEmpty());
        GraphElement call = store.children(origin, ModelRoles.VALUE).get(0);
        assertEquals(ElementKind.EXPR_CALL, call.getKind());
        // the only unit is Types.xscade
        assertEquals(store.get(point).getReference(ModelRoles.REF_STORAGE_UNIT), constant.getReference(ModelRoles.REF_STORAGE_UNIT));
        assertEquals(origin, session.lookup("Origin"));
    }

    @Test
    void ambiguousOwnerLeavesTreeReusable() {
        ModelBootstrap.addStorageUnit(store, model, "A.xscade");
        ModelBootstrap.addStorageUnit(store, model, "B.xscade");
        TreeNode definition = TypeTrees.table("int32", 4);
        String before = GraphSnapshots.toJson(store);

        assertThrows(AmbiguousOwnerException.class, () -> editor.createNamedType(model, "Vector", definition, null));

        assertEquals(before, GraphSnapshots.toJson(store));
        assertEquals(TreeState.UNVALIDATED, definition.getState());
        ElementId vector = editor.createNamedType(model, "Vector", definition, "./B.xscade");
        assertEquals("B.xscade", store.get(store.get(vector).getReference(ModelRoles.REF_STORAGE_UNIT)).getAttribute(ModelRoles.ATTR_PATH));
        assertEquals(TreeState.MATERIALIZED, definition.getState());
    }

    @Test
    void createEnumeration_recordsValues() {
        ElementId color = editor.createEnumeration(model, "Color", List.of("RED", "GREEN"), "Types.xscade");

        List<ElementId> added = editor.addEnumerationValues(color, List.of("BLUE"));

        ElementId enumeration = store.get(color).getReference(ModelRoles.REF_TYPE);
        assertEquals(List.of("RED", "GREEN", "BLUE"),
                store.children(enumeration, ModelRoles.VALUES).stream().map(GraphElement::getName).toList());
        assertEquals(added.get(0), session.lookup("BLUE"));
        assertEquals(ElementKind.ENUM_VALUE, store.get(session.lookup("RED")).getKind());
    }

    @Test
    void createPackage_nestedDeclarationsUseQualifiedPaths() {
        ElementId pkg = editor.createPackage(model, "P", "P.xscade");

        ElementId sensor = editor.createSensor(pkg, "Speed", "float64", null);

        assertEquals(sensor, session.lookup("P::Speed"));
        assertNull(store.get(sensor).getReference(ModelRoles.REF_STORAGE_UNIT));
        assertEquals(ElementKind.PACKAGE, store.get(store.get(sensor).getContainer()).getKind());
    }

    @Test
    void createOperator_interfaceWithTypeVariables() {
        ElementId op = editor.createOperator(model, "Gen", OperatorKind.GRAPHICAL, true, null);

        List<ElementId> inputs = editor.addOperatorInputs(op, List.of(
                NamedValue.of("a", "'T"), NamedValue.of("b", "'T"), NamedValue.of("c", "int32")));
        List<ElementId> outputs = editor.addOperatorOutputs(op, List.of(NamedValue.of("o", "'T")));

        List<GraphElement> typeVariables = store.children(op, ModelRoles.TYPEVARS);
        assertEquals(1, typeVariables.size());
        ElementId t = typeVariables.get(0).getId();
        assertEquals(t, store.get(inputs.get(0)).getReference(ModelRoles.REF_TYPE));
        assertEquals(t, store.get(inputs.get(1)).getReference(ModelRoles.REF_TYPE));
        assertEquals(t, store.get(outputs.get(0)).getReference(ModelRoles.REF_TYPE));
        assertEquals(session.lookupType("int32"), store.get(inputs.get(2)).getReference(ModelRoles.REF_TYPE));
        assertEquals(ElementKind.NET_DIAGRAM, store.get(diagramOf(op)).getKind());
        GraphElement unit = store.get(store.get(op).getReference(ModelRoles.REF_STORAGE_UNIT));
        assertEquals("Gen.xscade", unit.getAttribute(ModelRoles.ATTR_PATH));
    }

    @Test
    void addEquation_internalsAndPlacement() {
        ElementId op = graphicalOperator("Op");
        ElementId diagram = diagramOf(op);
        ElementId in = editor.addOperatorInputs(op, List.of(NamedValue.of("i", "int32"))).get(0);
        ElementId x = editor.addLocals(op, List.of(NamedValue.of("x", "int32"))).get(0);

        EquationHandles first = editor.addEquation(op, diagram, List.of(x), ExpressionTrees.binary(Construct.PLUS, in, 1));
        EquationHandles second = editor.addEquation(op, diagram, List.of("int32", "bool"),
                ExpressionTrees.call(op, List.of(in)));

        assertEquals(List.of(x), first.lefts());
        assertEquals(List.of(x), store.get(first.equation()).getReferences(ModelRoles.REF_LEFTS));
        assertEquals(first.right(), store.children(first.equation(), ModelRoles.RIGHT).get(0).getId());
        assertEquals(List.of("_L1", "_L2"), second.lefts().stream().map(id -> store.get(id).getName()).toList());
        assertEquals(session.lookupType("bool"), store.get(second.lefts().get(1)).getReference(ModelRoles.REF_TYPE));
        PresentationEntry p1 = store.presentationOf(first.equation()).orElseThrow();
        PresentationEntry p2 = store.presentationOf(second.equation()).orElseThrow();
        assertEquals(Box.of(500, 500, 3000, 1500), p1.bounds());
        assertEquals(Box.of(4500, 500, 3000, 1500), p2.bounds());
        assertEquals(PresentationKinds.EQUATION, p1.kind());
    }

    @Test
    void addEquation_terminatorAndLeftRules() {
        ElementId op = graphicalOperator("Op");
        ElementId x = editor.addLocals(op, List.of(NamedValue.of("x", "int32"))).get(0);

        EquationHandles terminator = editor.addEquation(op, null, List.of("_"), ExpressionTrees.call(op, List.of()));

        assertTrue(store.get(terminator.equation()).getBoolean(ModelRoles.ATTR_TERMINATOR));
        assertTrue(terminator.lefts().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> editor.addEquation(op, null, List.of("_", x), null));
        assertThrows(IllegalArgumentException.class, () -> editor.addEquation(op, null, List.of("int32"), 1));
    }

    @Test
    void addEquation_textDiagramEntryHasNoGeometry() {
        ElementId op = editor.createOperator(model, "T", OperatorKind.TEXTUAL, false, "Ops.xscade");
        ElementId x = editor.addLocals(op, List.of(NamedValue.of("x", "int32"))).get(0);

        EquationHandles eq = editor.addEquation(op, diagramOf(op), List.of(x), 3);

        PresentationEntry entry = store.presentationOf(eq.equation()).orElseThrow();
        assertEquals(PresentationKinds.TEXT, entry.kind());
        assertEquals(Point.ORIGIN, entry.position());
    }

    @Test
    void variableDefaultAndLast() {
        ElementId op = graphicalOperator("Op");
        ElementId x = editor.addLocals(op, List.of(NamedValue.of("x", "int32"))).get(0);

        editor.setVariableDefault(x, 0);
        editor.setVariableLast(x, 1);

        assertEquals(ElementKind.CONST_VALUE, store.children(x, ModelRoles.DEFAULT).get(0).getKind());
        assertEquals("1", store.children(x, ModelRoles.LAST).get(0).getAttribute(ModelRoles.ATTR_VALUE));
        assertThrows(IllegalStateException.class, () -> editor.setVariableDefault(x, 2));
    }

    @Test
    void stateMachine_statesPlacedInsideMachineAndTransition() {
        ElementId op = graphicalOperator("Op");
        ElementId sm = editor.addStateMachine(op, "SM", diagramOf(op), null, null);
        ElementId idle = editor.addState(sm, "Idle", StateKind.INITIAL);
        ElementId run = editor.addState(sm, "Run", StateKind.NORMAL, DisplayKind.SPLIT, null, null);

        ElementId transition = editor.addTransition(idle, TransitionKind.STRONG, TransitionTrees.toState(true, run));

        Box machine = store.presentationOf(sm).orElseThrow().bounds();
        Box idleBox = store.presentationOf(idle).orElseThrow().bounds();
        Box runBox = store.presentationOf(run).orElseThrow().bounds();
        assertTrue(machine.contains(idleBox));
        assertTrue(machine.contains(runBox));
        assertTrue(!idleBox.overlaps(runBox));
        assertTrue(store.get(idle).getBoolean(ModelRoles.ATTR_INITIAL));
        assertEquals(1, store.children(run, ModelRoles.DIAGRAMS).size());
        GraphElement main = store.get(transition);
        assertEquals(ElementKind.MAIN_TRANSITION, main.getKind());
        assertEquals(idle, main.getContainer());
        assertEquals(run, main.getReference(ModelRoles.REF_TARGET));
        assertEquals("Strong", main.getAttribute(ModelRoles.ATTR_KIND));
    }

    @Test
    void addIfBlock_presentsEveryNodeInsideBlock() {
        ElementId op = graphicalOperator("Op");
        ElementId diagram = diagramOf(op);
        ElementId c = editor.addOperatorInputs(op, List.of(NamedValue.of("c", "bool"))).get(0);
        TreeNode inner = BranchTrees.ifTree(c, BranchTrees.ifAction(), BranchTrees.ifAction(), null, 1200);
        TreeNode root = BranchTrees.ifTree(true, BranchTrees.ifAction(), inner);

        ElementId block = editor.addIfBlock(op, "IB", root, diagram, null, null);

        GraphElement ifNode = store.children(block, ModelRoles.IF_NODE).get(0);
        assertEquals(ElementKind.IF_NODE, ifNode.getKind());
        assertEquals(1, store.children(ifNode.getId(), ModelRoles.CONDITION).size());
        List<PresentationEntry> entries = store.presentations(diagram);
        assertEquals(6, entries.size());
        Box blockBox = store.presentationOf(block).orElseThrow().bounds();
        for (PresentationEntry e : entries) {
            assertTrue(blockBox.contains(e.bounds()), e.kind() + " outside the block");
        }
        assertEquals(ElementKind.ACTION, store.children(store.children(ifNode.getId(), ModelRoles.THEN).get(0).getId(),
                ModelRoles.ACTION).get(0).getKind());
        GraphElement innerNode = store.children(ifNode.getId(), ModelRoles.ELSE).get(0);
        assertEquals(1200, store.presentationOf(innerNode.getId()).orElseThrow().attributes().get(ModelRoles.ATTR_LABEL_WIDTH));
        assertNull(store.presentationOf(ifNode.getId()).orElseThrow().attributes().get(ModelRoles.ATTR_LABEL_WIDTH));
    }

    @Test
    void addEquation_afterBlockTakesNextGridCell() {
        ElementId op = graphicalOperator("Op");
        ElementId diagram = diagramOf(op);
        ElementId x = editor.addLocals(op, List.of(NamedValue.of("x", "int32"))).get(0);
        ElementId block = editor.addIfBlock(op, "IB",
                BranchTrees.ifTree(true, BranchTrees.ifAction(), BranchTrees.ifAction()), diagram, null, null);

        EquationHandles eq = editor.addEquation(op, diagram, List.of(x), 1);

        Box blockBox = store.presentationOf(block).orElseThrow().bounds();
        assertEquals(Box.of(500, 500, 5400, 4800), blockBox);
        // second column, pushed below the block it would overlap
        assertEquals(Box.of(4500, 6100, 3000, 1500), store.presentationOf(eq.equation()).orElseThrow().bounds());
    }

    @Test
    void addIfBlock_sharedBranchIsRejected() {
        ElementId op = graphicalOperator("Op");
        TreeNode action = BranchTrees.ifAction();
        TreeNode root = BranchTrees.ifTree(true, action, action);
        int count = store.elementCount();

        ValidationException ex = assertThrows(ValidationException.class,
                () -> editor.addIfBlock(op, "IB", root, diagramOf(op), null, null));

        assertEquals(ValidationRule.SINGLE_OWNER, ex.getRule());
        assertEquals(count, store.elementCount());
    }

    @Test
    void addWhenBlock_labelsOffsetIntoActions() {
        ElementId op = graphicalOperator("Op");
        ElementId diagram = diagramOf(op);
        ElementId x = editor.addOperatorInputs(op, List.of(NamedValue.of("x", "int32"))).get(0);

        ElementId block = editor.addWhenBlock(op, "WB", x,
                List.of(BranchTrees.whenBranch(1), BranchTrees.whenBranch(2)), diagram, new Point(1000, 1000), null);

        List<GraphElement> branches = store.children(block, ModelRoles.WHEN_BRANCHES);
        assertEquals(2, branches.size());
        for (GraphElement branch : branches) {
            Box label = store.presentationOf(branch.getId()).orElseThrow().bounds();
            ElementId action = store.children(branch.getId(), ModelRoles.ACTION).get(0).getId();
            Box actionBox = store.presentationOf(action).orElseThrow().bounds();
            assertEquals(actionBox.top() + 300, label.top());
            assertEquals(1000 + 500 + 300, label.left());
        }
        assertEquals(new Point(1000, 1000), store.presentationOf(block).orElseThrow().position());
        assertThrows(IllegalArgumentException.class, () -> editor.addWhenBlock(op, "Empty", x, List.of(), diagram, null, null));
    }

    @Test
    void addAssertionAndSignals() {
        ElementId op = graphicalOperator("Op");
        ElementId c = editor.addOperatorInputs(op, List.of(NamedValue.of("c", "bool"))).get(0);

        ElementId assertion = editor.addAssertion(op, diagramOf(op), "A1", c, AssertionKind.GUARANTEE, null);
        List<ElementId> signals = editor.addSignals(op, List.of("s1", "s2"));

        assertEquals("GUARANTEE", store.get(assertion).getAttribute(ModelRoles.ATTR_KIND));
        assertEquals(ElementKind.EXPR_ID, store.children(assertion, ModelRoles.EXPRESSION).get(0).getKind());
        assertEquals(PresentationKinds.ASSERTION, store.presentationOf(assertion).orElseThrow().kind());
        assertEquals(2, signals.size());
        assertEquals(ElementKind.SIGNAL, store.get(signals.get(1)).getKind());
    }
}

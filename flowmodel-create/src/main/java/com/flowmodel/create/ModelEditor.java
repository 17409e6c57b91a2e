package com.flowmodel.create;

import com.flowmodel.config.FlowModelConfig;
import com.flowmodel.config.LayoutDefaults;
import com.flowmodel.config.LayoutDefaultsLoader;
import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.GraphStore;
import com.flowmodel.graph.ModelRoles;
import com.flowmodel.graph.Point;
import com.flowmodel.graph.Size;
import com.flowmodel.session.SessionRegistry;
import com.flowmodel.tree.build.NamedValue;
import com.flowmodel.tree.node.TreeNode;

import java.util.List;
import java.util.Objects;

/**
 * Creation surface for batch scripts: every operation validates the trees it receives, then
 * creates the whole declaration in one atomic step. On any error the graph is left unchanged and
 * the trees are consumed.
 * <p>
 * Type arguments accept anything a {@link com.flowmodel.tree.build.TypeTrees} operand accepts: a
 * predefined or declared type name, an existing type element, or a type tree. Expression
 * arguments accept literals, existing elements and expression trees.
 * <p>
 * The session must have a declared model; new named declarations are recorded in it.
 */
public class ModelEditor {

    private final DeclarationOperations declarations;
    private final DataDefOperations dataDefs;
    private final StateMachineOperations stateMachines;
    private final BlockOperations blocks;

    public ModelEditor(GraphStore store, SessionRegistry session, FlowModelConfig config, LayoutDefaults layout) {
        EditContext ctx = new EditContext(Objects.requireNonNull(store, "store"), Objects.requireNonNull(session, "session"),
                Objects.requireNonNull(config, "config"), Objects.requireNonNull(layout, "layout"));
        this.declarations = new DeclarationOperations(ctx);
        this.dataDefs = new DataDefOperations(ctx);
        this.stateMachines = new StateMachineOperations(ctx);
        this.blocks = new BlockOperations(ctx);
    }

    /** Editor configured from the environment, with layout defaults from the configured file. */
    public static ModelEditor fromEnvironment(GraphStore store, SessionRegistry session) {
        FlowModelConfig config = FlowModelConfig.fromEnvironment();
        return new ModelEditor(store, session, config, LayoutDefaultsLoader.forConfig(config).load());
    }

    // declarations

    /**
     * @param owner model or package
     * @param path  storage unit path, or null for the default unit
     */
    public ElementId createPackage(ElementId owner, String name, String path) {
        return declarations.createPackage(owner, name, path);
    }

    /** Named type whose definition is given by {@code definition}. */
    public ElementId createNamedType(ElementId owner, String name, Object definition, String path) {
        return declarations.createNamedType(owner, name, definition, path);
    }

    public ElementId createImportedType(ElementId owner, String name, String path) {
        return declarations.createImportedType(owner, name, path);
    }

    public ElementId createEnumeration(ElementId owner, String name, List<String> values, String path) {
        return declarations.createEnumeration(owner, name, values, path);
    }

    public List<ElementId> addEnumerationValues(ElementId type, List<String> values) {
        return declarations.addEnumerationValues(type, values);
    }

    public ElementId createConstant(ElementId owner, String name, Object type, Object value, String path) {
        return declarations.createConstant(owner, name, type, value, path);
    }

    public ElementId createImportedConstant(ElementId owner, String name, Object type, String path) {
        return declarations.createImportedConstant(owner, name, type, path);
    }

    public ElementId createSensor(ElementId owner, String name, Object type, String path) {
        return declarations.createSensor(owner, name, type, path);
    }

    public ElementId createOperator(ElementId owner, String name, OperatorKind kind, boolean state, String path) {
        return declarations.createOperator(owner, name, kind, state, path);
    }

    /** Inputs as name/type pairs; a type spelled {@code 'T} is a type variable of the operator. */
    public List<ElementId> addOperatorInputs(ElementId operator, List<NamedValue> inputs) {
        return declarations.addOperatorInputs(operator, inputs);
    }

    public List<ElementId> addOperatorOutputs(ElementId operator, List<NamedValue> outputs) {
        return declarations.addOperatorOutputs(operator, outputs);
    }

    public List<ElementId> addOperatorHidden(ElementId operator, List<NamedValue> hidden) {
        return declarations.addOperatorHidden(operator, hidden);
    }

    // data definitions

    public List<ElementId> addLocals(ElementId dataDef, List<NamedValue> variables) {
        return dataDefs.addLocals(dataDef, variables, false);
    }

    public List<ElementId> addProbes(ElementId dataDef, List<NamedValue> variables) {
        return dataDefs.addLocals(dataDef, variables, true);
    }

    public List<ElementId> addSignals(ElementId dataDef, List<String> names) {
        return dataDefs.addSignals(dataDef, names);
    }

    public ElementId addNetDiagram(ElementId dataDef, String name) {
        return dataDefs.addDiagram(dataDef, name, ElementKind.NET_DIAGRAM);
    }

    public ElementId addTextDiagram(ElementId dataDef, String name) {
        return dataDefs.addDiagram(dataDef, name, ElementKind.TEXT_DIAGRAM);
    }

    public ElementId setVariableDefault(ElementId variable, Object expression) {
        return dataDefs.setVariableExpression(variable, ModelRoles.DEFAULT, expression);
    }

    public ElementId setVariableLast(ElementId variable, Object expression) {
        return dataDefs.setVariableExpression(variable, ModelRoles.LAST, expression);
    }

    /**
     * Adds an equation to a data definition.
     *
     * @param diagram  diagram showing the equation, or null
     * @param lefts    existing local variables, {@code "_"} alone for a terminator, or types of
     *                 internal variables to create
     * @param right    right-hand expression, or null
     * @param position null for the next free cell of the diagram
     * @param size     null for the default equation size
     */
    public EquationHandles addEquation(ElementId dataDef, ElementId diagram, List<?> lefts, Object right,
                                       Point position, Size size) {
        return dataDefs.addEquation(dataDef, diagram, lefts, right, position, size);
    }

    public EquationHandles addEquation(ElementId dataDef, ElementId diagram, List<?> lefts, Object right) {
        return addEquation(dataDef, diagram, lefts, right, null, null);
    }

    public ElementId addAssertion(ElementId dataDef, ElementId diagram, String name, Object expression,
                                  AssertionKind kind, Point position) {
        return dataDefs.addAssertion(dataDef, diagram, name, expression, kind, position);
    }

    // state machines

    public ElementId addStateMachine(ElementId dataDef, String name, ElementId diagram, Point position, Size size) {
        return stateMachines.addStateMachine(dataDef, name, diagram, position, size);
    }

    public ElementId addState(ElementId machine, String name, StateKind kind, DisplayKind display,
                              Point position, Size size) {
        return stateMachines.addState(machine, name, kind, display, position, size);
    }

    public ElementId addState(ElementId machine, String name, StateKind kind) {
        return addState(machine, name, kind, DisplayKind.GRAPHICAL, null, null);
    }

    /** Adds an outgoing transition of {@code source}; see {@link com.flowmodel.tree.build.TransitionTrees}. */
    public ElementId addTransition(ElementId source, TransitionKind kind, TreeNode tree) {
        return stateMachines.addTransition(source, kind, tree);
    }

    // blocks

    public ElementId addIfBlock(ElementId dataDef, String name, TreeNode ifTree, ElementId diagram,
                                Point position, Size size) {
        return blocks.addIfBlock(dataDef, name, ifTree, diagram, position, size);
    }

    public ElementId addWhenBlock(ElementId dataDef, String name, Object when, List<TreeNode> branches,
                                  ElementId diagram, Point position, Size size) {
        return blocks.addWhenBlock(dataDef, name, when, branches, diagram, position, size);
    }
}

package com.flowmodel.create;

import com.flowmodel.graph.Box;
import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.GraphElement;
import com.flowmodel.graph.ModelRoles;
import com.flowmodel.graph.Point;
import com.flowmodel.graph.Size;
import com.flowmodel.materializer.MaterializationResult;
import com.flowmodel.materializer.PlanRef;
import com.flowmodel.tree.build.NamedValue;
import com.flowmodel.tree.ref.Slot;
import com.flowmodel.tree.validate.TreeInput;
import com.flowmodel.tree.validate.ValidatedTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Variables, diagrams, equations and assertions of a data definition (operator, state or action).
 */
final class DataDefOperations {

    private static final Logger log = LoggerFactory.getLogger(DataDefOperations.class);

    static final String TERMINATOR = "_";

    private final EditContext ctx;

    DataDefOperations(EditContext ctx) {
        this.ctx = ctx;
    }

    List<ElementId> addLocals(ElementId dataDef, List<NamedValue> variables, boolean probe) {
        ctx.requireDataDef(dataDef);
        List<TreeInput> inputs = new ArrayList<>();
        for (NamedValue v : variables) {
            EditContext.requireName(v.name(), "variable");
            inputs.add(TreeInput.of(v.value(), Slot.TYPE));
        }
        MaterializationResult result = ctx.materialize(ctx.validate(dataDef, inputs), (plan, expander) -> {
            PlanRef owner = PlanRef.existing(dataDef);
            for (int i = 0; i < variables.size(); i++) {
                PlanRef type = expander.type(inputs.get(i).ref());
                Map<String, Object> attrs = new LinkedHashMap<>();
                attrs.put(ModelRoles.ATTR_NAME, variables.get(i).name());
                if (probe) attrs.put(ModelRoles.ATTR_PROBE, true);
                PlanRef variable = plan.create(ElementKind.LOCAL_VARIABLE, attrs, owner, ModelRoles.LOCALS);
                expander.bindType(variable, type, ModelRoles.BUILD_TYPE);
                plan.tag("var:" + i, variable);
            }
            return owner;
        });
        return result.taggedWithPrefix("var:");
    }

    List<ElementId> addSignals(ElementId dataDef, List<String> names) {
        ctx.requireDataDef(dataDef);
        names.forEach(n -> EditContext.requireName(n, "signal"));
        MaterializationResult result = ctx.materialize(ctx.validate(dataDef, List.of()), (plan, expander) -> {
            PlanRef owner = PlanRef.existing(dataDef);
            for (int i = 0; i < names.size(); i++) {
                plan.tag("signal:" + i, plan.create(ElementKind.SIGNAL, Map.of(ModelRoles.ATTR_NAME, names.get(i)),
                        owner, ModelRoles.SIGNALS));
            }
            return owner;
        });
        return result.taggedWithPrefix("signal:");
    }

    ElementId addDiagram(ElementId dataDef, String name, ElementKind kind) {
        ctx.requireDataDef(dataDef);
        EditContext.requireName(name, "diagram");
        return ctx.materialize(ctx.validate(dataDef, List.of()), (plan, expander) ->
                plan.create(kind, Map.of(ModelRoles.ATTR_NAME, name), PlanRef.existing(dataDef), ModelRoles.DIAGRAMS)).root();
    }

    /** Sets the default ({@code role} = default) or last ({@code role} = last) value of a variable. */
    ElementId setVariableExpression(ElementId variable, String role, Object expression) {
        ctx.require(variable, "variable", ElementKind.LOCAL_VARIABLE);
        if (!ctx.store().children(variable, role).isEmpty()) {
            throw new IllegalStateException("variable " + variable + " already has a " + role + " expression");
        }
        List<TreeInput> inputs = List.of(TreeInput.of(expression, Slot.FLOW));
        return ctx.materialize(ctx.validate(variable, inputs), (plan, expander) -> {
            PlanRef value = expander.expression(inputs.get(0).ref());
            plan.attach(value, PlanRef.existing(variable), role);
            return value;
        }).root();
    }

    /**
     * Adds an equation. Each left is an existing local variable, the terminator {@code "_"} alone,
     * or a type for an internal variable created on the fly; internals need a diagram.
     */
    EquationHandles addEquation(ElementId dataDef, ElementId diagram, List<?> lefts, Object right,
                                Point position, Size size) {
        ctx.requireDataDef(dataDef);
        GraphElement diagramElement = ctx.optionalDiagram(diagram);
        boolean terminator = lefts.contains(TERMINATOR);
        if (terminator && lefts.size() != 1) {
            throw new IllegalArgumentException("the terminator '_' must be the only left of an equation");
        }
        List<TreeInput> inputs = new ArrayList<>();
        TreeInput rightInput = right != null ? TreeInput.of(right, Slot.FLOW) : null;
        if (rightInput != null) inputs.add(rightInput);
        Map<Integer, TreeInput> internalTypes = new HashMap<>();
        for (int i = 0; i < lefts.size(); i++) {
            Object left = lefts.get(i);
            if (TERMINATOR.equals(left) || isVariable(left)) continue;
            if (diagramElement == null) {
                throw new IllegalArgumentException("left " + i + " creates an internal variable, which requires a diagram");
            }
            TreeInput type = TreeInput.of(left, Slot.TYPE);
            internalTypes.put(i, type);
            inputs.add(type);
        }
        ValidatedTrees trees = ctx.validate(dataDef, inputs);
        Set<String> taken = new HashSet<>(ctx.childNames(dataDef, ModelRoles.INTERNALS));
        MaterializationResult result = ctx.materialize(trees, (plan, expander) -> {
            PlanRef owner = PlanRef.existing(dataDef);
            PlanRef rightRef = rightInput != null ? expander.expression(rightInput.ref()) : null;
            List<PlanRef> leftRefs = new ArrayList<>();
            for (int i = 0; i < lefts.size(); i++) {
                Object left = lefts.get(i);
                if (TERMINATOR.equals(left)) continue;
                TreeInput type = internalTypes.get(i);
                if (type == null) {
                    leftRefs.add(PlanRef.existing((ElementId) left));
                    continue;
                }
                PlanRef typeRef = expander.type(type.ref());
                PlanRef internal = plan.create(ElementKind.LOCAL_VARIABLE,
                        Map.of(ModelRoles.ATTR_NAME, internalName(taken)), owner, ModelRoles.INTERNALS);
                expander.bindType(internal, typeRef, ModelRoles.BUILD_TYPE);
                leftRefs.add(internal);
            }
            PlanRef equation = plan.create(ElementKind.EQUATION,
                    terminator ? Map.<String, Object>of(ModelRoles.ATTR_TERMINATOR, true) : Map.<String, Object>of(), owner, ModelRoles.FLOWS);
            if (rightRef != null) {
                plan.attach(rightRef, equation, ModelRoles.RIGHT);
                plan.tag("right", rightRef);
            }
            for (int i = 0; i < leftRefs.size(); i++) {
                plan.link(equation, ModelRoles.REF_LEFTS, leftRefs.get(i));
                plan.tag("left:" + i, leftRefs.get(i));
            }
            if (diagramElement != null) {
                if (ctx.isTextDiagram(diagramElement)) {
                    ctx.presentAsText(plan, equation, diagram);
                } else {
                    Box box = ctx.flowBox(diagram, position, size, ctx.placement().equationSize());
                    plan.present(equation, PlanRef.existing(diagram), PresentationKinds.EQUATION, box, Map.of());
                }
            }
            return equation;
        });
        log.debug("Added equation {} to {}", result.root(), dataDef);
        return new EquationHandles(result.root(), result.taggedWithPrefix("left:"), result.tagged("right").orElse(null));
    }

    ElementId addAssertion(ElementId dataDef, ElementId diagram, String name, Object expression,
                           AssertionKind kind, Point position) {
        ctx.requireDataDef(dataDef);
        EditContext.requireName(name, "assertion");
        GraphElement diagramElement = ctx.optionalDiagram(diagram);
        List<TreeInput> inputs = List.of(TreeInput.of(expression, Slot.BOOL));
        return ctx.materialize(ctx.validate(dataDef, inputs), (plan, expander) -> {
            PlanRef condition = expander.expression(inputs.get(0).ref());
            PlanRef assertion = plan.create(ElementKind.ASSERTION,
                    Map.of(ModelRoles.ATTR_NAME, name, ModelRoles.ATTR_KIND, kind.name()),
                    PlanRef.existing(dataDef), ModelRoles.FLOWS);
            plan.attach(condition, assertion, ModelRoles.EXPRESSION);
            if (diagramElement != null) {
                if (ctx.isTextDiagram(diagramElement)) {
                    ctx.presentAsText(plan, assertion, diagram);
                } else {
                    Box box = ctx.flowBox(diagram, position, null, ctx.placement().equationSize());
                    plan.present(assertion, PlanRef.existing(diagram), PresentationKinds.ASSERTION, box, Map.of());
                }
            }
            return assertion;
        }).root();
    }

    private boolean isVariable(Object left) {
        return left instanceof ElementId id && ctx.store().contains(id)
                && ctx.store().get(id).getKind() == ElementKind.LOCAL_VARIABLE;
    }

    /** Next free {@code _L<n>} name; n starts after the existing internals. */
    private String internalName(Set<String> taken) {
        String prefix = ctx.config().getInternalPrefix();
        int index = taken.size() + 1;
        while (taken.contains(prefix + index)) index++;
        String name = prefix + index;
        taken.add(name);
        return name;
    }
}

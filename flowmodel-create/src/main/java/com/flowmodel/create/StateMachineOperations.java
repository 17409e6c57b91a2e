package com.flowmodel.create;

import com.flowmodel.graph.Box;
import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.GraphElement;
import com.flowmodel.graph.ModelRoles;
import com.flowmodel.graph.Point;
import com.flowmodel.graph.PresentationEntry;
import com.flowmodel.graph.Size;
import com.flowmodel.materializer.PlanRef;
import com.flowmodel.tree.node.TreeNode;
import com.flowmodel.tree.ref.Slot;
import com.flowmodel.tree.validate.TreeInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State machines, their states and transitions. States are presented in the diagram of their
 * machine, and only when the machine is drawn in a net diagram.
 */
final class StateMachineOperations {

    private static final Logger log = LoggerFactory.getLogger(StateMachineOperations.class);

    private final EditContext ctx;

    StateMachineOperations(EditContext ctx) {
        this.ctx = ctx;
    }

    ElementId addStateMachine(ElementId dataDef, String name, ElementId diagram, Point position, Size size) {
        ctx.requireDataDef(dataDef);
        EditContext.requireName(name, "state machine");
        GraphElement diagramElement = ctx.optionalDiagram(diagram);
        return ctx.materialize(ctx.validate(dataDef, List.of()), (plan, expander) -> {
            PlanRef machine = plan.create(ElementKind.STATE_MACHINE, Map.of(ModelRoles.ATTR_NAME, name),
                    PlanRef.existing(dataDef), ModelRoles.FLOWS);
            if (diagramElement != null) {
                if (ctx.isTextDiagram(diagramElement)) {
                    ctx.presentAsText(plan, machine, diagram);
                } else {
                    Box box = ctx.flowBox(diagram, position, size, ctx.placement().stateMachineSize());
                    plan.present(machine, PlanRef.existing(diagram), PresentationKinds.STATE_MACHINE, box, Map.of());
                }
            }
            return machine;
        }).root();
    }

    /** Adds a state; a split state gets its own net diagram named after it. */
    ElementId addState(ElementId machine, String name, StateKind kind, DisplayKind display, Point position, Size size) {
        ctx.require(machine, "state machine", ElementKind.STATE_MACHINE);
        EditContext.requireName(name, "state");
        Optional<PresentationEntry> machineEntry = ctx.presentationOf(machine)
                .filter(e -> ctx.store().get(e.diagram()).getKind() == ElementKind.NET_DIAGRAM);
        ElementId state = ctx.materialize(ctx.validate(machine, List.of()), (plan, expander) -> {
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put(ModelRoles.ATTR_NAME, name);
            attrs.put(ModelRoles.ATTR_INITIAL, kind == StateKind.INITIAL);
            attrs.put(ModelRoles.ATTR_FINAL, kind == StateKind.FINAL);
            PlanRef created = plan.create(ElementKind.STATE, attrs, PlanRef.existing(machine), ModelRoles.STATES);
            if (machineEntry.isPresent()) {
                if (display == DisplayKind.SPLIT) {
                    plan.create(ElementKind.NET_DIAGRAM, Map.of(ModelRoles.ATTR_NAME, name), created, ModelRoles.DIAGRAMS);
                }
                Box box = stateBox(machine, machineEntry.get(), position, size);
                plan.present(created, PlanRef.existing(machineEntry.get().diagram()), PresentationKinds.STATE, box,
                        Map.of(ModelRoles.ATTR_DISPLAY, display.getValue()));
            }
            return created;
        }).root();
        log.debug("Added state {} to {}", name, machine);
        return state;
    }

    /** Adds an outgoing transition of {@code source} built from a transition tree. */
    ElementId addTransition(ElementId source, TransitionKind kind, TreeNode tree) {
        ctx.require(source, "state", ElementKind.STATE);
        List<TreeInput> inputs = List.of(TreeInput.of(tree, Slot.TRANSITION));
        return ctx.materialize(ctx.validate(source, inputs), (plan, expander) -> {
            PlanRef transition = expander.transition(inputs.get(0).ref());
            plan.setAttribute(transition, ModelRoles.ATTR_KIND, kind.getValue());
            plan.attach(transition, PlanRef.existing(source), ModelRoles.OUTGOINGS);
            return transition;
        }).root();
    }

    private Box stateBox(ElementId machine, PresentationEntry machineEntry, Point position, Size size) {
        Size effective = size != null ? size : ctx.placement().stateSize();
        if (position != null) return new Box(position, effective);
        List<Box> siblings = new ArrayList<>();
        for (GraphElement state : ctx.store().children(machine, ModelRoles.STATES)) {
            ctx.presentationOf(state.getId()).ifPresent(e -> siblings.add(e.bounds()));
        }
        Box cell = ctx.placement().placeState(machineEntry.bounds(), siblings);
        return new Box(cell.position(), effective);
    }
}

package com.flowmodel.create;

import com.flowmodel.config.FlowModelConfig;
import com.flowmodel.config.LayoutDefaults;
import com.flowmodel.graph.Box;
import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.GraphElement;
import com.flowmodel.graph.GraphStore;
import com.flowmodel.graph.NamedElement;
import com.flowmodel.graph.Point;
import com.flowmodel.graph.PresentationEntry;
import com.flowmodel.graph.Size;
import com.flowmodel.materializer.CreationPlan;
import com.flowmodel.materializer.MaterializationResult;
import com.flowmodel.materializer.Materializer;
import com.flowmodel.materializer.PlanBuilder;
import com.flowmodel.materializer.PlanRef;
import com.flowmodel.materializer.ownership.OwnershipResolver;
import com.flowmodel.materializer.placement.PlacementEngine;
import com.flowmodel.session.SessionRegistry;
import com.flowmodel.tree.validate.StructuralValidator;
import com.flowmodel.tree.validate.TreeInput;
import com.flowmodel.tree.validate.ValidatedTrees;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Collaborators and helpers shared by the editing operations. */
final class EditContext {

    private static final Box NO_GEOMETRY = new Box(Point.ORIGIN, Size.EMPTY);

    private final GraphStore store;
    private final SessionRegistry session;
    private final FlowModelConfig config;
    private final StructuralValidator validator;
    private final Materializer materializer;
    private final PlacementEngine placement;
    private final OwnershipResolver ownership;

    EditContext(GraphStore store, SessionRegistry session, FlowModelConfig config, LayoutDefaults layout) {
        this.store = store;
        this.session = session;
        this.config = config;
        this.validator = new StructuralValidator(store, session);
        this.materializer = new Materializer(store);
        this.placement = new PlacementEngine(layout);
        this.ownership = new OwnershipResolver(store, config);
    }

    GraphStore store() {
        return store;
    }

    FlowModelConfig config() {
        return config;
    }

    PlacementEngine placement() {
        return placement;
    }

    OwnershipResolver ownership() {
        return ownership;
    }

    ValidatedTrees validate(ElementId anchor, List<TreeInput> inputs) {
        return validator.validate(anchor, inputs);
    }

    MaterializationResult materialize(ValidatedTrees trees, PlanBuilder builder) {
        return materializer.materialize(trees, builder);
    }

    /** Element {@code id}, checked against the accepted kinds; any kind when none is given. */
    GraphElement require(ElementId id, String what, ElementKind... kinds) {
        if (id == null || !store.contains(id)) {
            throw new IllegalArgumentException(what + " " + id + " does not exist");
        }
        GraphElement element = store.get(id);
        if (kinds.length > 0 && !Arrays.asList(kinds).contains(element.getKind())) {
            throw new IllegalArgumentException(what + " must be one of " + Arrays.toString(kinds)
                    + ", got " + element.getKind());
        }
        return element;
    }

    GraphElement requireDataDef(ElementId id) {
        GraphElement element = require(id, "data definition");
        if (!element.getKind().isDataDef()) {
            throw new IllegalArgumentException("data definition must be an operator, state or action, got " + element.getKind());
        }
        return element;
    }

    /** Diagram argument: null, or a net or text diagram. */
    GraphElement optionalDiagram(ElementId diagram) {
        return diagram == null ? null : require(diagram, "diagram", ElementKind.NET_DIAGRAM, ElementKind.TEXT_DIAGRAM);
    }

    static String requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(what + " name is required");
        }
        return name;
    }

    /** Qualified path of a declaration named {@code name} in {@code owner}. */
    String pathOf(ElementId owner, String name) {
        List<String> segments = new ArrayList<>();
        for (ElementId current = owner; current != null; current = store.get(current).getContainer()) {
            GraphElement element = store.get(current);
            if (element.getKind() != ElementKind.PACKAGE) break;
            segments.add(element.getName());
        }
        Collections.reverse(segments);
        segments.add(name);
        return String.join("::", segments);
    }

    /** Makes a committed declaration visible to later trees. */
    void record(ElementId owner, String name, ElementId id) {
        session.record(new NamedElement(pathOf(owner, name), id, store.get(id).getKind()));
    }

    /** Boxes of the top-level flows of a diagram. */
    List<Box> boxesIn(ElementId diagram) {
        List<Box> boxes = new ArrayList<>();
        for (PresentationEntry entry : store.presentations(diagram)) {
            if (PresentationKinds.TOP_LEVEL.contains(entry.kind())) boxes.add(entry.bounds());
        }
        return boxes;
    }

    Optional<PresentationEntry> presentationOf(ElementId element) {
        return store.presentationOf(element);
    }

    /** Plans the text-diagram entry of a flow. */
    void presentAsText(CreationPlan plan, PlanRef element, ElementId diagram) {
        plan.present(element, PlanRef.existing(diagram), PresentationKinds.TEXT, NO_GEOMETRY, Map.of());
    }

    /** Names of the children of {@code container} under {@code role}. */
    List<String> childNames(ElementId container, String role) {
        List<String> names = new ArrayList<>();
        for (GraphElement child : store.children(container, role)) {
            if (child.getName() != null) names.add(child.getName());
        }
        return names;
    }

    boolean isTextDiagram(GraphElement diagram) {
        return diagram.getKind() == ElementKind.TEXT_DIAGRAM;
    }

    /** Box of a flow placed in a net diagram; caller geometry wins. */
    Box flowBox(ElementId diagram, Point position, Size size, Size defaultSize) {
        Size effective = size != null ? size : defaultSize;
        if (position != null) return new Box(position, effective);
        return placement.placeInDiagram(boxesIn(diagram), effective);
    }
}

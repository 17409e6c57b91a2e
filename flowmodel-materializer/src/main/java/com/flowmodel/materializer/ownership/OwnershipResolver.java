package com.flowmodel.materializer.ownership;

import com.flowmodel.config.FlowModelConfig;
import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.GraphElement;
import com.flowmodel.graph.GraphStore;
import com.flowmodel.graph.ModelRoles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Chooses the storage unit owning a new top-level declaration. Read-only: the decision is carried
 * out by the plan that creates the declaration.
 * <ol>
 *   <li>explicit path: the unit with that path, created when missing</li>
 *   <li>the unit referenced by the nearest enclosing element</li>
 *   <li>the model's default file</li>
 *   <li>the model's only unit, or a unit named after the element when there is none</li>
 * </ol>
 */
public final class OwnershipResolver {

    private static final Logger log = LoggerFactory.getLogger(OwnershipResolver.class);

    private final GraphStore store;
    private final FlowModelConfig config;

    public OwnershipResolver(GraphStore store, FlowModelConfig config) {
        this.store = store;
        this.config = config;
    }

    public OwnerDecision resolve(ElementId container, String elementName, String explicitPath) {
        ElementId model = modelOf(container);
        if (explicitPath != null && !explicitPath.isBlank()) {
            return byPath(model, explicitPath);
        }
        for (ElementId current = container; current != null; current = store.get(current).getContainer()) {
            ElementId unit = store.get(current).getReference(ModelRoles.REF_STORAGE_UNIT);
            if (unit != null) {
                log.debug("Owner of {} inherited from {}: {}", elementName, current, unit);
                return OwnerDecision.existing(model, unit);
            }
        }
        Object defaultFile = store.get(model).getAttribute(ModelRoles.ATTR_DEFAULT_FILE);
        if (defaultFile instanceof String path && !path.isBlank()) {
            return byPath(model, path);
        }
        List<GraphElement> units = store.children(model, ModelRoles.STORAGE_UNITS);
        if (units.size() == 1) {
            return OwnerDecision.existing(model, units.get(0).getId());
        }
        if (units.isEmpty()) {
            return OwnerDecision.create(model, config.unitPathFor(elementName));
        }
        List<String> candidates = new ArrayList<>();
        for (GraphElement u : units) candidates.add(String.valueOf(u.getAttribute(ModelRoles.ATTR_PATH)));
        throw new AmbiguousOwnerException(elementName, candidates);
    }

    static String normalize(String path) {
        String p = path.trim().replace('\\', '/');
        while (p.startsWith("./")) p = p.substring(2);
        return p;
    }

    private OwnerDecision byPath(ElementId model, String path) {
        String normalized = normalize(path);
        for (GraphElement unit : store.children(model, ModelRoles.STORAGE_UNITS)) {
            Object unitPath = unit.getAttribute(ModelRoles.ATTR_PATH);
            if (unitPath instanceof String s && normalize(s).equals(normalized)) {
                return OwnerDecision.existing(model, unit.getId());
            }
        }
        return OwnerDecision.create(model, normalized);
    }

    private ElementId modelOf(ElementId container) {
        ElementId current = container;
        while (current != null) {
            GraphElement element = store.get(current);
            if (element.getKind() == ElementKind.MODEL) return current;
            current = element.getContainer();
        }
        throw new IllegalArgumentException(container + " is not inside a model");
    }
}

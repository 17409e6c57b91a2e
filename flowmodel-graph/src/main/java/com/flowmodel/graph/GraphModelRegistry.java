package com.flowmodel.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link ModelRegistry} computed directly from the graph store on every call.
 * Paths use {@code ::} between package segments; enumeration values are declared in the
 * package that holds their enumeration type.
 */
public final class GraphModelRegistry implements ModelRegistry {

    private static final List<String> DECLARATION_ROLES = List.of(
            ModelRoles.CONSTRAINTS, ModelRoles.CONSTANTS, ModelRoles.SENSORS, ModelRoles.OPERATORS);

    private final GraphStore store;

    public GraphModelRegistry(GraphStore store) {
        this.store = store;
    }

    @Override
    public List<NamedElement> allNamedElements(ElementId model) {
        List<NamedElement> result = new ArrayList<>();
        Set<ElementId> visited = new HashSet<>();
        collectModel(model, result, visited);
        return result;
    }

    @Override
    public Optional<ElementId> findPredefined(String name) {
        Optional<GraphElement> library = PredefinedLibrary.find(store);
        if (library.isEmpty() || name == null) return Optional.empty();
        ElementId lib = library.get().getId();
        for (String role : List.of(ModelRoles.TYPES, ModelRoles.CONSTRAINTS)) {
            for (GraphElement e : store.children(lib, role)) {
                if (name.equals(e.getName())) return Optional.of(e.getId());
            }
        }
        return Optional.empty();
    }

    private void collectModel(ElementId model, List<NamedElement> out, Set<ElementId> visited) {
        if (!visited.add(model) || !store.contains(model)) return;
        collectPackage(model, "", out);
        for (ElementId library : store.get(model).getReferences(ModelRoles.REF_LIBRARIES)) {
            collectModel(library, out, visited);
        }
    }

    private void collectPackage(ElementId pkg, String prefix, List<NamedElement> out) {
        for (GraphElement child : store.children(pkg, ModelRoles.PACKAGES)) {
            String path = prefix + child.getName();
            out.add(new NamedElement(path, child.getId(), child.getKind()));
            collectPackage(child.getId(), path + "::", out);
        }
        for (GraphElement type : store.children(pkg, ModelRoles.TYPES)) {
            if (type.getName() == null) continue;
            out.add(new NamedElement(prefix + type.getName(), type.getId(), type.getKind()));
            for (GraphElement definition : store.children(type.getId(), ModelRoles.DEFINITION)) {
                if (definition.getKind() != ElementKind.ENUMERATION) continue;
                for (GraphElement value : store.children(definition.getId(), ModelRoles.VALUES)) {
                    out.add(new NamedElement(prefix + value.getName(), value.getId(), value.getKind()));
                }
            }
        }
        for (String role : DECLARATION_ROLES) {
            for (GraphElement e : store.children(pkg, role)) {
                if (e.getName() != null) {
                    out.add(new NamedElement(prefix + e.getName(), e.getId(), e.getKind()));
                }
            }
        }
    }
}

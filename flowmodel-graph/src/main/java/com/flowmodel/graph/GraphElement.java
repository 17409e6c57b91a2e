package com.flowmodel.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of the semantic graph: kind, attribute values, one containment parent (absent only for
 * models) and named non-owning references. Instances are owned by a {@link GraphStore}; callers
 * see read-only views and change elements only through store primitives.
 */
public final class GraphElement {

    private final ElementId id;
    private final ElementKind kind;
    private final ElementId container;
    private final String role;
    private final Map<String, Object> attributes;
    private final List<ElementId> children = new ArrayList<>();
    private final Map<String, List<ElementId>> references = new LinkedHashMap<>();

    GraphElement(ElementId id, ElementKind kind, ElementId container, String role, Map<String, Object> attributes) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.container = container;
        this.role = role;
        this.attributes = new LinkedHashMap<>(attributes);
    }

    public ElementId getId() {
        return id;
    }

    public ElementKind getKind() {
        return kind;
    }

    /** Containment parent, or null for a model. */
    public ElementId getContainer() {
        return container;
    }

    /** Containment role under the parent, or null for a model. */
    public String getRole() {
        return role;
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public String getName() {
        Object name = attributes.get(ModelRoles.ATTR_NAME);
        return name instanceof String s ? s : null;
    }

    public boolean getBoolean(String key) {
        return Boolean.TRUE.equals(attributes.get(key));
    }

    /** Contained children in creation order, all roles. */
    public List<ElementId> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Map<String, List<ElementId>> getReferences() {
        Map<String, List<ElementId>> view = new LinkedHashMap<>();
        references.forEach((name, targets) -> view.put(name, List.copyOf(targets)));
        return Collections.unmodifiableMap(view);
    }

    /** Targets of a named reference in link order; empty when never linked. */
    public List<ElementId> getReferences(String name) {
        List<ElementId> targets = references.get(name);
        return targets == null ? List.of() : List.copyOf(targets);
    }

    /** First target of a named reference, or null. */
    public ElementId getReference(String name) {
        List<ElementId> targets = references.get(name);
        return targets == null || targets.isEmpty() ? null : targets.get(0);
    }

    void addChild(ElementId child) {
        children.add(child);
    }

    void addReference(String name, ElementId target) {
        references.computeIfAbsent(name, k -> new ArrayList<>()).add(target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphElement that = (GraphElement) o;
        return Objects.equals(id, that.id) && kind == that.kind
                && Objects.equals(container, that.container)
                && Objects.equals(role, that.role)
                && Objects.equals(attributes, that.attributes)
                && Objects.equals(children, that.children)
                && Objects.equals(references, that.references);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, container, role, attributes, children, references);
    }

    @Override
    public String toString() {
        String name = getName();
        return kind + (name != null ? "(" + name + ")" : "") + id;
    }
}

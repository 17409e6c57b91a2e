package com.flowmodel.graph;

import java.util.Objects;

/**
 * A model element reachable by qualified path, e.g. {@code Pkg::Point} or {@code Color::RED}.
 */
public record NamedElement(String path, ElementId id, ElementKind kind) {

    public NamedElement {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
    }

    /** Last segment of the path. */
    public String simpleName() {
        int idx = path.lastIndexOf("::");
        return idx < 0 ? path : path.substring(idx + 2);
    }
}

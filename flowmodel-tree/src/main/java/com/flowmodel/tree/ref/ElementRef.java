package com.flowmodel.tree.ref;

import com.flowmodel.graph.ElementId;

import java.util.Objects;

/** Handle to an element that already exists in the graph store. */
public record ElementRef(ElementId id) implements ExtendedRef {

    public ElementRef {
        Objects.requireNonNull(id, "id");
    }

    @Override
    public Kind kind() {
        return Kind.ELEMENT;
    }

    @Override
    public String describe() {
        return "element " + id;
    }
}

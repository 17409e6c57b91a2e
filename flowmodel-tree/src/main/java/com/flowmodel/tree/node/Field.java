package com.flowmodel.tree.node;

import com.flowmodel.tree.ref.ExtendedRef;

import java.util.Objects;

/** Named child of a composite node. */
public record Field(String name, ExtendedRef value) {

    public Field {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}

package com.flowmodel.tree.ref;

import java.util.Objects;

/**
 * Name resolved through the session registry at validation time: a predefined type such as
 * {@code float32}, or the {@code ::} path of a declared element.
 */
public record PredefinedNameRef(String name) implements ExtendedRef {

    public PredefinedNameRef {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public Kind kind() {
        return Kind.PREDEFINED_NAME;
    }

    @Override
    public String describe() {
        return "name '" + name + "'";
    }
}

package com.flowmodel.tree.ref;

import java.util.Objects;

/** Literal scalar or array, already encoded for its kind. */
public record LiteralRef(Literal literal) implements ExtendedRef {

    public LiteralRef {
        Objects.requireNonNull(literal, "literal");
    }

    @Override
    public Kind kind() {
        return Kind.LITERAL;
    }

    @Override
    public String describe() {
        return "literal " + literal;
    }
}

package com.flowmodel.tree.ref;

import java.util.List;
import java.util.Objects;

/**
 * Typed literal. A scalar has exactly one value; an array has one or more values of the same kind.
 * Values are kept in their source spelling ({@code 42}, {@code 42.0_f32}, {@code 'c'}).
 */
public record Literal(LiteralKind kind, List<String> values, boolean array) {

    public Literal {
        Objects.requireNonNull(kind, "kind");
        values = values != null ? List.copyOf(values) : List.of();
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Literal needs at least one value");
        }
        if (!array && values.size() != 1) {
            throw new IllegalArgumentException("Scalar literal needs exactly one value");
        }
    }

    public static Literal scalar(LiteralKind kind, String text) {
        return new Literal(kind, List.of(text), false);
    }

    public static Literal array(LiteralKind kind, List<String> values) {
        return new Literal(kind, values, true);
    }

    /** Spelling of a scalar, or the first item of an array. */
    public String text() {
        return values.get(0);
    }

    /** Numeric value of an integer scalar, ignoring any width suffix. */
    public long intValue() {
        if (kind != LiteralKind.INT || array) {
            throw new IllegalStateException("Not an integer scalar: " + this);
        }
        String t = text();
        int suffix = t.indexOf('_');
        if (suffix > 0) t = t.substring(0, suffix);
        boolean negative = t.startsWith("-");
        if (negative || t.startsWith("+")) t = t.substring(1);
        long v;
        if (t.startsWith("0x")) {
            v = Long.parseLong(t.substring(2), 16);
        } else if (t.startsWith("0b")) {
            v = Long.parseLong(t.substring(2), 2);
        } else {
            v = Long.parseLong(t);
        }
        return negative ? -v : v;
    }

    @Override
    public String toString() {
        return array ? kind + values.toString() : kind + "(" + values.get(0) + ")";
    }
}

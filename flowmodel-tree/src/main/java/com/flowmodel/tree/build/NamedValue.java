package com.flowmodel.tree.build;

/**
 * Name paired with a raw value: a structure field and its type, a labelled struct value, an
 * operator input and its type.
 */
public record NamedValue(String name, Object value) {

    public static NamedValue of(String name, Object value) {
        return new NamedValue(name, value);
    }
}

package com.flowmodel.tree.ref;

/**
 * Value accepted wherever a tree child is expected: a nested tree, an existing element, a literal
 * or a name resolved at validation time. Produced by {@link ExtendedRefResolver}.
 */
public interface ExtendedRef {

    enum Kind {
        TREE,
        ELEMENT,
        LITERAL,
        PREDEFINED_NAME
    }

    Kind kind();

    /** Short human-readable form used in error messages. */
    String describe();
}

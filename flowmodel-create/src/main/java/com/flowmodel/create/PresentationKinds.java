package com.flowmodel.create;

import java.util.Set;

/**
 * Graphical forms written on presentation entries.
 */
public final class PresentationKinds {

    public static final String EQUATION = "equation";
    public static final String ASSERTION = "assertion";
    public static final String STATE_MACHINE = "stateMachine";
    public static final String STATE = "state";
    public static final String IF_BLOCK = "ifBlock";
    public static final String IF_NODE = "ifNode";
    public static final String IF_ACTION = "ifAction";
    public static final String WHEN_BLOCK = "whenBlock";
    public static final String WHEN_LABEL = "whenLabel";
    public static final String WHEN_ACTION = "whenAction";
    /** Entry of a flow in a text diagram; carries no geometry. */
    public static final String TEXT = "text";

    /** Forms that occupy a cell of the diagram grid; nested entries live inside one of these. */
    public static final Set<String> TOP_LEVEL = Set.of(EQUATION, ASSERTION, STATE_MACHINE, IF_BLOCK, WHEN_BLOCK);

    private PresentationKinds() {
    }
}

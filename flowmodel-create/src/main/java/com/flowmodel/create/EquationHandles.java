package com.flowmodel.create;

import com.flowmodel.graph.ElementId;

import java.util.List;

/**
 * Elements of a created equation.
 *
 * @param lefts defined variables in order, existing or created as internals; empty for a terminator
 * @param right root of the right-hand expression, or null when the equation has none
 */
public record EquationHandles(ElementId equation, List<ElementId> lefts, ElementId right) {

    public EquationHandles {
        lefts = List.copyOf(lefts);
    }
}

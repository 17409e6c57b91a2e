package com.flowmodel.tree.build;

import com.flowmodel.tree.node.HigherOrder;

import java.util.Arrays;
import java.util.List;

/**
 * Higher-order modifier applied to an operator call, e.g. {@code map <<4>>} or
 * {@code restart every c}.
 */
public record Modifier(HigherOrder kind, List<Object> parameters) {

    public Modifier {
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    public static Modifier of(HigherOrder kind, Object... parameters) {
        return new Modifier(kind, Arrays.asList(parameters));
    }

    public static Modifier restart(Object condition) {
        return of(HigherOrder.RESTART, condition);
    }

    public static Modifier activate(Object clock, Object defaultValue) {
        return of(HigherOrder.ACTIVATE, clock, defaultValue);
    }

    public static Modifier activateNoInit(Object clock) {
        return of(HigherOrder.ACTIVATE_NO_INIT, clock);
    }

    public static Modifier map(Object size) {
        return of(HigherOrder.MAP, size);
    }

    public static Modifier fold(Object size) {
        return of(HigherOrder.FOLD, size);
    }

    public static Modifier mapfold(Object size) {
        return of(HigherOrder.MAPFOLD, size);
    }
}

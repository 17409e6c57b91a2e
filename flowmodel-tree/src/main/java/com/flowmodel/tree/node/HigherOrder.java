package com.flowmodel.tree.node;

import com.flowmodel.tree.ref.Slot;

import java.util.List;

/**
 * Higher-order modifiers applicable to an operator call, with the parameters each one takes
 * (iteration size, condition, default or clock).
 */
public enum HigherOrder {
    RESTART("restart", List.of(Slot.BOOL)),
    ACTIVATE("activate", List.of(Slot.FLOW, Slot.FLOW)),
    ACTIVATE_NO_INIT("activate_noinit", List.of(Slot.FLOW)),
    MAP("map", List.of(Slot.INT)),
    MAPI("mapi", List.of(Slot.INT)),
    FOLD("fold", List.of(Slot.INT)),
    FOLDI("foldi", List.of(Slot.INT)),
    MAPFOLD("mapfold", List.of(Slot.INT)),
    MAPFOLDI("mapfoldi", List.of(Slot.INT)),
    FOLDW("foldw", List.of(Slot.INT, Slot.BOOL)),
    FOLDWI("foldwi", List.of(Slot.INT, Slot.BOOL)),
    MAPW("mapw", List.of(Slot.INT, Slot.BOOL, Slot.FLOW)),
    MAPWI("mapwi", List.of(Slot.INT, Slot.BOOL, Slot.FLOW)),
    MAPFOLDW("mapfoldw", List.of(Slot.INT, Slot.BOOL, Slot.FLOW)),
    MAPFOLDWI("mapfoldwi", List.of(Slot.INT, Slot.BOOL, Slot.FLOW));

    private final String code;
    private final List<Slot> parameters;

    HigherOrder(String code, List<Slot> parameters) {
        this.code = code;
        this.parameters = parameters;
    }

    public String getCode() {
        return code;
    }

    public List<Slot> getParameters() {
        return parameters;
    }

    public static HigherOrder fromCode(String code) {
        for (HigherOrder h : values()) {
            if (h.code.equals(code)) return h;
        }
        throw new IllegalArgumentException("Unknown higher-order modifier: " + code);
    }
}

package com.flowmodel.tree.ref;

import com.flowmodel.graph.FlowModelException;

/**
 * Thrown when a caller value cannot be interpreted under the expected slot.
 */
public final class ResolutionException extends FlowModelException {

    private final Slot slot;
    private final String value;

    public ResolutionException(Object value, Slot slot, String message) {
        super("Cannot resolve " + show(value) + " as " + slot + ": " + message);
        this.slot = slot;
        this.value = show(value);
    }

    public Slot getSlot() {
        return slot;
    }

    /** Printable form of the rejected value. */
    public String getValue() {
        return value;
    }

    private static String show(Object value) {
        if (value == null) return "null";
        if (value instanceof String s) return "\"" + s + "\"";
        return String.valueOf(value);
    }
}

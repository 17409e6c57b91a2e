package com.flowmodel.create;

/**
 * Layout of a state or block body inside its diagram.
 */
public enum DisplayKind {
    GRAPHICAL("EmbeddedGraphical"),
    TEXTUAL("EmbeddedTextual"),
    /** Body shown in a separate diagram. */
    SPLIT("Split");

    private final String value;

    DisplayKind(String value) {
        this.value = value;
    }

    /** Attribute value stored on the presentation entry. */
    public String getValue() {
        return value;
    }
}

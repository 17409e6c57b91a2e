package com.flowmodel.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kind of a graph element. Snapshots use the enum name as string;
 * unknown values deserialize as {@link #UNKNOWN}.
 */
public enum ElementKind {
    MODEL,
    STORAGE_UNIT,
    PACKAGE,
    PREDEFINED_TYPE,
    TYPE_CONSTRAINT,
    NAMED_TYPE,
    SIZED_TYPE,
    TABLE,
    STRUCTURE,
    ENUMERATION,
    /** Polymorphic type parameter of an operator, e.g. {@code 'T}. */
    TYPE_VARIABLE,
    ENUM_VALUE,
    /** Field of a structure. */
    COMPOSITE_ELEMENT,
    CONSTANT,
    SENSOR,
    OPERATOR,
    LOCAL_VARIABLE,
    SIGNAL,
    EQUATION,
    ASSERTION,
    CONST_VALUE,
    EXPR_ID,
    EXPR_TYPE,
    EXPR_CALL,
    LABEL,
    NET_DIAGRAM,
    TEXT_DIAGRAM,
    STATE_MACHINE,
    STATE,
    MAIN_TRANSITION,
    FORKED_TRANSITION,
    ACTION,
    IF_BLOCK,
    IF_NODE,
    IF_ACTION,
    WHEN_BLOCK,
    WHEN_BRANCH,
    UNKNOWN;

    private static final Set<ElementKind> TYPES = EnumSet.of(
            PREDEFINED_TYPE, NAMED_TYPE, SIZED_TYPE, TABLE, STRUCTURE, ENUMERATION, TYPE_VARIABLE);
    private static final Set<ElementKind> FLOW_REFERENCES = EnumSet.of(
            CONSTANT, SENSOR, LOCAL_VARIABLE, ENUM_VALUE);
    private static final Set<ElementKind> DATA_DEFS = EnumSet.of(OPERATOR, STATE, ACTION);
    private static final Set<ElementKind> TRANSITIONS = EnumSet.of(MAIN_TRANSITION, FORKED_TRANSITION);

    /** Type definitions, named or anonymous. */
    public boolean isType() {
        return TYPES.contains(this);
    }

    /** Elements an identifier expression may refer to. */
    public boolean isFlowReference() {
        return FLOW_REFERENCES.contains(this);
    }

    public boolean isDiagram() {
        return this == NET_DIAGRAM || this == TEXT_DIAGRAM;
    }

    /** Scopes owning variables, diagrams and flows. */
    public boolean isDataDef() {
        return DATA_DEFS.contains(this);
    }

    public boolean isTransition() {
        return TRANSITIONS.contains(this);
    }

    /** Elements that can own top-level declarations. */
    public boolean isPackage() {
        return this == MODEL || this == PACKAGE;
    }

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static ElementKind fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toUpperCase();
        for (ElementKind k : values()) {
            if (k != UNKNOWN && k.name().equals(normalized)) return k;
        }
        return UNKNOWN;
    }
}

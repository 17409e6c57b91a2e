package com.flowmodel.tree.ref;

import com.flowmodel.graph.ElementKind;
import com.flowmodel.tree.node.TreeDomain;

/**
 * Expected kind of a tree position. Drives literal parsing in the resolver and the acceptance
 * checks of the validator.
 */
public enum Slot {
    TYPE,
    FLOW,
    BOOL,
    INT,
    REAL,
    CHAR,
    PATH,
    PATTERN,
    STATE,
    OPERATOR,
    TRANSITION,
    BRANCH;

    /** Positions that materialize as expression elements. */
    public boolean isExpression() {
        return switch (this) {
            case FLOW, BOOL, INT, REAL, CHAR, PATTERN -> true;
            default -> false;
        };
    }

    /** Literal kind demanded by a kind-specific slot, or null. */
    public LiteralKind literalKind() {
        return switch (this) {
            case BOOL -> LiteralKind.BOOL;
            case INT -> LiteralKind.INT;
            case REAL -> LiteralKind.REAL;
            case CHAR -> LiteralKind.CHAR;
            default -> null;
        };
    }

    public boolean acceptsDomain(TreeDomain domain) {
        return switch (this) {
            case TYPE -> domain == TreeDomain.TYPE;
            case FLOW, BOOL, INT, REAL, CHAR -> domain == TreeDomain.EXPRESSION;
            case TRANSITION -> domain == TreeDomain.TRANSITION;
            case BRANCH -> domain == TreeDomain.BRANCH;
            default -> false;
        };
    }

    public boolean acceptsLiteral(Literal literal) {
        return switch (this) {
            case FLOW -> true;
            case BOOL, INT, REAL, CHAR -> literal.kind() == literalKind();
            case PATTERN -> !literal.array() && literal.kind() != LiteralKind.REAL;
            default -> false;
        };
    }

    public boolean acceptsElement(ElementKind kind) {
        return switch (this) {
            case TYPE -> kind.isType();
            case FLOW, BOOL, INT, REAL, CHAR -> kind.isFlowReference();
            case PATTERN -> kind == ElementKind.ENUM_VALUE || kind == ElementKind.CONSTANT;
            case PATH -> kind != ElementKind.UNKNOWN;
            case STATE -> kind == ElementKind.STATE;
            case OPERATOR -> kind == ElementKind.OPERATOR;
            case TRANSITION, BRANCH -> false;
        };
    }

    /** Slots where a bare string is a name rather than a literal spelling. */
    public boolean acceptsName() {
        return switch (this) {
            case TYPE, PATH, PATTERN, OPERATOR -> true;
            default -> false;
        };
    }
}

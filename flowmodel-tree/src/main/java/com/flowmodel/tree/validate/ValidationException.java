package com.flowmodel.tree.validate;

import com.flowmodel.graph.FlowModelException;

/**
 * Thrown when a tree violates a structural rule. Names the first offending node and the rule;
 * the graph store is never touched when this is raised.
 */
public final class ValidationException extends FlowModelException {

    private final String node;
    private final ValidationRule rule;

    public ValidationException(String node, ValidationRule rule, String message) {
        super(format(node, rule, message));
        this.node = node;
        this.rule = rule;
    }

    public ValidationException(String node, ValidationRule rule, String message, Throwable cause) {
        super(format(node, rule, message), cause);
        this.node = node;
        this.rule = rule;
    }

    /** Location and description of the offending node, e.g. {@code $.then[0] IF_ACTION node}. */
    public String getNode() {
        return node;
    }

    public ValidationRule getRule() {
        return rule;
    }

    private static String format(String node, ValidationRule rule, String message) {
        return rule + " violated at " + node + ": " + message;
    }
}

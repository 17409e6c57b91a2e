package com.flowmodel.graph;

/**
 * Thrown when the graph store refuses a primitive: unknown container, dangling reference target,
 * presentation for an element that does not exist, or an unsupported attribute value.
 */
public final class GraphStoreException extends FlowModelException {

    private final String operation;

    public GraphStoreException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
    }

    /** Name of the refused primitive (createElement, link, createPresentation, commit). */
    public String getOperation() {
        return operation;
    }
}

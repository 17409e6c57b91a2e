package com.flowmodel.graph;

/**
 * Root of every failure raised while building or materializing model elements.
 * Callers can catch this type to handle all creation errors uniformly; the graph is
 * left unchanged whenever one of these is thrown from a creation operation.
 */
public class FlowModelException extends RuntimeException {

    public FlowModelException(String message) {
        super(message);
    }

    public FlowModelException(String message, Throwable cause) {
        super(message, cause);
    }
}

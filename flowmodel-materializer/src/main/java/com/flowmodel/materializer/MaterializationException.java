package com.flowmodel.materializer;

import com.flowmodel.graph.FlowModelException;

/**
 * Thrown when the graph store refuses a write after validation passed. The staged batch has been
 * discarded: the store is unchanged and the trees involved are FAILED.
 */
public final class MaterializationException extends FlowModelException {

    public MaterializationException(String message, Throwable cause) {
        super(message, cause);
    }
}

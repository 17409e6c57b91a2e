package com.flowmodel.session;

import com.flowmodel.graph.FlowModelException;

/**
 * Thrown when a predefined name or element path is not known in the declared model.
 */
public final class UnknownNameException extends FlowModelException {

    private final String name;

    public UnknownNameException(String name, String what) {
        super("Unknown " + what + ": " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

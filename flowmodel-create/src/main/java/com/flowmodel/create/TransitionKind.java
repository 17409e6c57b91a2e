package com.flowmodel.create;

public enum TransitionKind {
    WEAK("Weak"),
    STRONG("Strong"),
    SYNCHRO("Synchro");

    private final String value;

    TransitionKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}

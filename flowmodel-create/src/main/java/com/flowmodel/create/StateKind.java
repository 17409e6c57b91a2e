package com.flowmodel.create;

public enum StateKind {
    NORMAL,
    INITIAL,
    FINAL
}

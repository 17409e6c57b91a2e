package com.flowmodel.create;

public enum AssertionKind {
    ASSUME,
    GUARANTEE
}

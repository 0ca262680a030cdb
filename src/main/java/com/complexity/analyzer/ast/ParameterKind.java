package com.complexity.analyzer.ast;

public enum ParameterKind {
    SCALAR("Scalar"),
    ARRAY("Array"),
    OBJECT("Object");

    private final String displayName;

    ParameterKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

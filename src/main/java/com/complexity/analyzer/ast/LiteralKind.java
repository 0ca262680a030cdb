package com.complexity.analyzer.ast;

public enum LiteralKind {
    INTEGER("Integer"),
    REAL("Real"),
    STRING("String"),
    BOOLEAN("Boolean"),
    NULL("Null");

    private final String displayName;

    LiteralKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

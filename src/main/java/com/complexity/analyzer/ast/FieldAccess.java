package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.Objects;

public final class FieldAccess extends Expression {

    private final String baseText;
    private final String fieldName;

    public FieldAccess(String baseText, String fieldName) {
        this.baseText = Objects.requireNonNull(baseText);
        this.fieldName = Objects.requireNonNull(fieldName);
    }

    public String getBaseText() {
        return baseText;
    }

    public String getFieldName() {
        return fieldName;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String toString() {
        return baseText + "." + fieldName;
    }
}

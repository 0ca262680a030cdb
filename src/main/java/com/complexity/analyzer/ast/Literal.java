package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.Objects;

/**
 * A literal, kept as its source text (string literals include the quotes).
 */
public final class Literal extends Expression {

    private final String value;
    private final LiteralKind kind;

    public Literal(String value, LiteralKind kind) {
        this.value = Objects.requireNonNull(value);
        this.kind = Objects.requireNonNull(kind);
    }

    public String getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String toString() {
        return value;
    }
}

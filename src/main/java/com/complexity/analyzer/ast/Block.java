package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.List;

/**
 * Statements executed in listed order.
 */
public final class Block extends Node {

    private final List<Statement> statements;

    public Block(List<Statement> statements) {
        this.statements = List.copyOf(statements);
    }

    public static Block empty() {
        return new Block(List.of());
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}

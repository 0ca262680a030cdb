package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.Objects;

public final class BinaryOp extends Expression {

    private final Expression left;
    private final String operator;
    private final Expression right;

    public BinaryOp(Expression left, String operator, Expression right) {
        this.left = Objects.requireNonNull(left);
        this.operator = Objects.requireNonNull(operator);
        this.right = Objects.requireNonNull(right);
    }

    public Expression getLeft() {
        return left;
    }

    public String getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}

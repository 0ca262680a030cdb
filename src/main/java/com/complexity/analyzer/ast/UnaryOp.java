package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.Objects;

/**
 * Prefix operators ({@code -}, {@code not}) and the built-in functions
 * {@code length}, {@code ceil} and {@code floor}.
 */
public final class UnaryOp extends Expression {

    private final String operator;
    private final Expression operand;

    public UnaryOp(String operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator);
        this.operand = Objects.requireNonNull(operand);
    }

    public String getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public String toString() {
        switch (operator) {
            case "-":
                return "-" + operand;
            case "not":
                return "not " + operand;
            default:
                return operator + "(" + operand + ")";
        }
    }
}

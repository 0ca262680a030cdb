package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.Objects;

/**
 * {@code target <- value}. The target is kept as the parsed lvalue
 * expression; {@link #getTargetText()} gives its flattened form.
 */
public final class Assignment extends Statement {

    private final Expression target;
    private final Expression value;

    public Assignment(Expression target, Expression value) {
        this.target = Objects.requireNonNull(target);
        this.value = Objects.requireNonNull(value);
    }

    public Expression getTarget() {
        return target;
    }

    public String getTargetText() {
        return target.toString();
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}

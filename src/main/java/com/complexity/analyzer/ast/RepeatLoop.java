package com.complexity.analyzer.ast;

import com.complexity.analyzer.visitor.NodeVisitor;

import java.util.Objects;

/**
 * {@code repeat ... until (condition)}; the body runs before the condition.
 */
public final class RepeatLoop extends Statement {

    private final Expression condition;
    private final Block body;

    public RepeatLoop(Expression condition, Block body) {
        this.condition = Objects.requireNonNull(condition);
        this.body = Objects.requireNonNull(body);
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
